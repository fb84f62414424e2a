package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;

public record AddManualShowRequest(
        @NotBlank String rowId,
        @NotBlank @Pattern(regexp = "^\\d{1,2}:\\d{1,2}$", message = "Use HH:MM (e.g. 19:05)") String start
) {}
