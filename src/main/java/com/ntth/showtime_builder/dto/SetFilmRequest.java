package com.ntth.showtime_builder.dto;

/** null or blank clears the override. */
public record SetFilmRequest(String filmId) {}
