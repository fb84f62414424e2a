package com.ntth.showtime_builder.pojo;

import org.springframework.data.annotation.Id;

import java.time.Instant;

/** One key of the schedule state, stored as a JSON string. */
public class PersistedState {
    @Id
    private String key;
    private String json;
    private Instant updatedAt;

    public PersistedState() {}

    public PersistedState(String key, String json, Instant updatedAt) {
        this.key = key;
        this.json = json;
        this.updatedAt = updatedAt;
    }

    public String getKey() { return key; }
    public void setKey(String key) { this.key = key; }

    public String getJson() { return json; }
    public void setJson(String json) { this.json = json; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
