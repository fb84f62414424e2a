package com.ntth.showtime_builder.pojo;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;

import java.time.Instant;

/**
 * A resolved, displayable show. Derived on every resolution, never stored.
 * {@code end} excludes clean time; {@link #nextAvailable()} includes it.
 */
@Builder(toBuilder = true)
public record Show(
        String id,
        @JsonIgnore RowRef rowRef,
        Integer offset,      // step from the prime show, null for manual shows
        Integer audId,
        String audName,
        String filmId,
        String filmTitle,
        Instant start,
        Instant end,
        int runtimeMin,
        int trailerMin,
        int cleanMin,
        int cycleMinutes,
        ShowSource source
) {
    @JsonProperty("rowId")
    public String rowId() {
        return rowRef.key();
    }

    public Instant nextAvailable() {
        return start.plusSeconds(60L * cycleMinutes);
    }
}
