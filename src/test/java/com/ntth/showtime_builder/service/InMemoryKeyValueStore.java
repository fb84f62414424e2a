package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.repository.KeyValueStore;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/** Map-backed store for tests; {@link #failWrites} simulates an unreachable database. */
class InMemoryKeyValueStore implements KeyValueStore {

    final Map<String, String> data = new HashMap<>();
    boolean failWrites;

    @Override
    public Optional<String> load(String key) {
        return Optional.ofNullable(data.get(key));
    }

    @Override
    public void save(String key, String json) {
        if (failWrites) throw new IllegalStateException("store offline");
        data.put(key, json);
    }

    @Override
    public void delete(String key) {
        data.remove(key);
    }
}
