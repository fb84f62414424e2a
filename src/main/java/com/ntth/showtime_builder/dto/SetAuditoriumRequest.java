package com.ntth.showtime_builder.dto;

/** null clears the override. */
public record SetAuditoriumRequest(Integer audId) {}
