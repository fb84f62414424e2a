package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.dto.CopyScheduleRequest;
import com.ntth.showtime_builder.dto.ScheduleDatesResponse;
import com.ntth.showtime_builder.dto.SwitchDateRequest;
import com.ntth.showtime_builder.service.ScheduleService;
import com.ntth.showtime_builder.util.TimeUtils;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/schedule/dates")
@Validated
public class ScheduleDateController {

    private final ScheduleService scheduleService;

    public ScheduleDateController(ScheduleService scheduleService) {
        this.scheduleService = scheduleService;
    }

    @GetMapping
    public ScheduleDatesResponse dates() {
        LocalDate current = scheduleService.currentDate();
        return new ScheduleDatesResponse(current.toString(), TimeUtils.toMmdd(current), scheduleService.listDates());
    }

    // PUT /api/schedule/dates/current  {"date":"2025-08-19"} or "08/19/2025"
    @PutMapping("/current")
    public ScheduleDatesResponse switchDate(@Valid @RequestBody SwitchDateRequest request) {
        scheduleService.switchDate(parse(request.date()));
        return dates();
    }

    // copy targets offered around a date
    @GetMapping("/nearby")
    public List<LocalDate> nearby(@RequestParam(required = false) String date) {
        return scheduleService.nearbyDates(date == null ? null : parse(date));
    }

    @PostMapping("/copy")
    public Map<String, Integer> copy(@Valid @RequestBody CopyScheduleRequest request) {
        LocalDate from = request.from() == null || request.from().isBlank() ? null : parse(request.from());
        List<LocalDate> targets = request.targets().stream().map(ScheduleDateController::parse).toList();
        return Map.of("copied", scheduleService.copySchedule(from, targets));
    }

    @DeleteMapping("/{date}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear(@PathVariable String date) {
        scheduleService.clearSchedule(parse(date));
    }

    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearAll() {
        scheduleService.clearAllSchedules();
    }

    private static LocalDate parse(String value) {
        return TimeUtils.parseDate(value)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.BAD_REQUEST, "Invalid date: " + value));
    }
}
