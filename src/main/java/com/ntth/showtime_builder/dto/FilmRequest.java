package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;

public record FilmRequest(
        @NotBlank(message = "Title cannot be blank") String title,
        String rating,
        @NotNull(message = "Runtime is required") @PositiveOrZero Integer runtimeMin,
        @PositiveOrZero Integer trailerMin,
        @PositiveOrZero Integer cleanMin,
        Double priority,
        String format
) {}
