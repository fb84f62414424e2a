package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.dto.BookingRequest;
import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/bookings")
@Validated
public class BookingController {

    private final CatalogService catalogService;

    public BookingController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    // sorted by numeric slot
    @GetMapping
    public List<Booking> getAll() {
        return catalogService.getAllBookings();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Booking create(@Valid @RequestBody BookingRequest request) {
        return catalogService.createBooking(request);
    }

    @PutMapping("/{id}")
    public Booking update(@PathVariable String id, @Valid @RequestBody BookingRequest request) {
        return catalogService.updateBooking(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        catalogService.deleteBooking(id);
    }

    // DELETE /api/bookings: every booking and every date's schedule
    @DeleteMapping
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearAll() {
        catalogService.clearBookingsAndTimes();
    }
}
