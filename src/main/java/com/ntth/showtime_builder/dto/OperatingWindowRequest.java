package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record OperatingWindowRequest(
        @NotBlank @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$", message = "Use HH:MM") String firstHM,
        @NotBlank @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$", message = "Use HH:MM") String lastHM
) {}
