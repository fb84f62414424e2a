package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Catalog;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;

import java.time.LocalDate;
import java.time.ZoneId;

/**
 * Everything an engine call works on: the show day, the wall-clock zone, the
 * operating window, the catalog and the active snapshot (mutated in place by edits).
 */
public record ScheduleSession(
        LocalDate date,
        ZoneId zone,
        OperatingWindow window,
        Catalog catalog,
        ScheduleSnapshot snapshot
) {}
