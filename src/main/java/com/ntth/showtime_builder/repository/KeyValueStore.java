package com.ntth.showtime_builder.repository;

import java.util.Optional;

/** Where the schedule state lives between runs: JSON documents under fixed keys. */
public interface KeyValueStore {

    Optional<String> load(String key);

    void save(String key, String json);

    void delete(String key);
}
