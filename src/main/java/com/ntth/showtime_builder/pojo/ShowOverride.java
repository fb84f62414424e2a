package com.ntth.showtime_builder.pojo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** Sparse per-show patch. Absent fields fall back to the generated show. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ShowOverride(Instant start, Integer audId, String filmId) {

    public static final ShowOverride EMPTY = new ShowOverride(null, null, null);

    public ShowOverride withStart(Instant start) {
        return new ShowOverride(start, audId, filmId);
    }

    public ShowOverride withAudId(Integer audId) {
        return new ShowOverride(start, audId, filmId);
    }

    public ShowOverride withFilmId(String filmId) {
        return new ShowOverride(start, audId, filmId);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return start == null && audId == null && filmId == null;
    }
}
