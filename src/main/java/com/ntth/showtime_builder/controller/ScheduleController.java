package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.dto.AddManualShowRequest;
import com.ntth.showtime_builder.dto.OperatingWindowRequest;
import com.ntth.showtime_builder.dto.RowUpdateRequest;
import com.ntth.showtime_builder.dto.SetAuditoriumRequest;
import com.ntth.showtime_builder.dto.SetFilmRequest;
import com.ntth.showtime_builder.dto.SetStartRequest;
import com.ntth.showtime_builder.dto.ShowMapper;
import com.ntth.showtime_builder.dto.ShowResponse;
import com.ntth.showtime_builder.pojo.OperatingWindow;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.service.ScheduleService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Optional;

/**
 * Show edits of the active date. Every mutation answers with the full resolved
 * show list so the caller can redraw without a second request.
 */
@RestController
@RequestMapping("/api/schedule")
@Validated
public class ScheduleController {

    private final ScheduleService scheduleService;
    private final ShowMapper mapper;

    public ScheduleController(ScheduleService scheduleService, ShowMapper mapper) {
        this.scheduleService = scheduleService;
        this.mapper = mapper;
    }

    // GET /api/schedule/shows
    @GetMapping("/shows")
    public List<ShowResponse> shows() {
        return mapper.toResponses(scheduleService.shows());
    }

    // PUT /api/schedule/shows/{showId}/start  {"start":"19:05"} or {"start":""} to hide
    @PutMapping("/shows/{showId}/start")
    public List<ShowResponse> setStart(@PathVariable String showId, @Valid @RequestBody SetStartRequest request) {
        return mapper.toResponses(scheduleService.setStart(showId, request.start()));
    }

    @PutMapping("/shows/{showId}/auditorium")
    public List<ShowResponse> setAuditorium(@PathVariable String showId, @RequestBody SetAuditoriumRequest request) {
        return mapper.toResponses(scheduleService.setAuditorium(showId, request.audId()));
    }

    @PutMapping("/shows/{showId}/film")
    public List<ShowResponse> setFilm(@PathVariable String showId, @RequestBody SetFilmRequest request) {
        return mapper.toResponses(scheduleService.setFilm(showId, request.filmId()));
    }

    // POST /api/schedule/shows/{showId}/nudge?direction=-1  (5 minutes earlier)
    @PostMapping("/shows/{showId}/nudge")
    public List<ShowResponse> nudge(@PathVariable String showId, @RequestParam int direction) {
        return mapper.toResponses(scheduleService.nudge(showId, direction));
    }

    @GetMapping("/shows/{showId}/start-options")
    public List<String> startOptions(@PathVariable String showId) {
        return scheduleService.startOptions(showId);
    }

    @PostMapping("/manual-shows")
    public List<ShowResponse> addManualShow(@Valid @RequestBody AddManualShowRequest request) {
        return mapper.toResponses(scheduleService.addManualShow(request.rowId(), request.start()));
    }

    @PostMapping("/undo")
    public List<ShowResponse> undo() {
        return mapper.toResponses(scheduleService.undo());
    }

    // ---- rows ----

    @GetMapping("/rows")
    public List<ScheduleRow> rows() {
        return scheduleService.rows();
    }

    @PostMapping("/rows")
    @ResponseStatus(HttpStatus.CREATED)
    public ScheduleRow addExtraRow() {
        return scheduleService.addExtraRow();
    }

    @DeleteMapping("/rows/{rowId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void removeExtraRow(@PathVariable String rowId) {
        if (!scheduleService.removeExtraRow(rowId)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Extra row not found");
        }
    }

    // PATCH /api/schedule/rows/{rowId}  {"field":"primeHM","value":"19:00"}
    @PatchMapping("/rows/{rowId}")
    public ScheduleRow updateRow(@PathVariable String rowId, @Valid @RequestBody RowUpdateRequest request) {
        Optional<ScheduleRow> row = switch (request.field()) {
            case "audId" -> scheduleService.setRowAuditorium(rowId, parseAudId(request.value()));
            case "filmId" -> scheduleService.setRowFilm(rowId, request.value());
            default -> scheduleService.setRowPrime(rowId, request.value() == null ? "" : request.value());
        };
        return row.orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Row not found"));
    }

    @PostMapping("/clear-times")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearAllTimes() {
        scheduleService.clearAllTimes();
    }

    // ---- operating window ----

    @GetMapping("/window")
    public OperatingWindow window() {
        return scheduleService.window();
    }

    @PutMapping("/window")
    public OperatingWindow setWindow(@Valid @RequestBody OperatingWindowRequest request) {
        return scheduleService.setWindow(new OperatingWindow(request.firstHM(), request.lastHM()));
    }

    private static Integer parseAudId(String value) {
        if (value == null || value.isBlank()) return null;
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "audId must be a number");
        }
    }
}
