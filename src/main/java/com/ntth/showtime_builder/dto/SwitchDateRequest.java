package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotBlank;

public record SwitchDateRequest(@NotBlank(message = "Date cannot be blank") String date) {}
