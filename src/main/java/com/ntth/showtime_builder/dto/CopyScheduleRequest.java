package com.ntth.showtime_builder.dto;

import jakarta.validation.constraints.NotEmpty;

import java.util.List;

/** Dates as ISO or MM/DD/YYYY; a missing {@code from} means the current date. */
public record CopyScheduleRequest(String from, @NotEmpty List<String> targets) {}
