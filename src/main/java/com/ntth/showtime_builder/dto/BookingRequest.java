package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

public record BookingRequest(
        @Positive Integer week,
        @NotBlank(message = "Slot cannot be blank") String slot,
        String filmId,
        String notes,
        @Positive Integer weeksOut
) {}
