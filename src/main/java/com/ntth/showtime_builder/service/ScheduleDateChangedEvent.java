package com.ntth.showtime_builder.service;

import java.time.LocalDate;

/** Published after the active schedule date has been switched. */
public record ScheduleDateChangedEvent(LocalDate previous, LocalDate current) {}
