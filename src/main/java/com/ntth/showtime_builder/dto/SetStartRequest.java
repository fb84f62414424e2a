package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Pattern;

/** "HH:MM", or an empty string to hide the show. */
public record SetStartRequest(
        @NotNull @Pattern(regexp = "^$|^\\d{1,2}:\\d{1,2}$", message = "Use HH:MM (e.g. 19:05) or empty") String start
) {}
