package com.ntth.showtime_builder.dto;

import java.time.Instant;

public record ShowResponse(
        String id,
        String rowId,
        Integer audId,
        String audName,
        String filmId,
        String filmTitle,
        String start,         // "19:05"
        String end,
        Instant startAt,
        Instant endAt,
        String nextAvailable, // start + cycle
        int runtimeMin,
        int trailerMin,
        int cleanMin,
        int cycleMinutes,
        String source
) {}
