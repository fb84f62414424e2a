package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.PositiveOrZero;

// all fields optional on create: blanks get "Aud N" / "Standard" / 100
public record AuditoriumRequest(
        String name,
        String format,
        @PositiveOrZero(message = "Seats must be non-negative") Integer seats
) {}
