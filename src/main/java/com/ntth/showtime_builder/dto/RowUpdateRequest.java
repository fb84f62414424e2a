package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/** Row edits, one field per request: {@code field} is audId, filmId or primeHM. */
public record RowUpdateRequest(
        @NotNull @Pattern(regexp = "audId|filmId|primeHM", message = "field must be audId, filmId or primeHM") String field,
        String value
) {}
