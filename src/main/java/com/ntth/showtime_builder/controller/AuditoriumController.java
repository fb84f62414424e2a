package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.dto.AuditoriumRequest;
import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/auditoriums")
@Validated
public class AuditoriumController {

    private final CatalogService catalogService;

    public AuditoriumController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    // GET /api/auditoriums
    @GetMapping
    public List<Auditorium> getAll() {
        return catalogService.getAllAuditoriums();
    }

    @GetMapping("/{id}")
    public Auditorium get(@PathVariable Integer id) {
        return catalogService.getAuditorium(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Auditorium create(@Valid @RequestBody AuditoriumRequest request) {
        return catalogService.createAuditorium(request);
    }

    @PutMapping("/{id}")
    public Auditorium update(@PathVariable Integer id, @Valid @RequestBody AuditoriumRequest request) {
        return catalogService.updateAuditorium(id, request);
    }

    // DELETE /api/auditoriums/{id}: rows and overrides on it are unassigned
    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Integer id) {
        catalogService.deleteAuditorium(id);
    }
}
