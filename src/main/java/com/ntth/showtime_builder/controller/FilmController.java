package com.ntth.showtime_builder.controller;

import com.ntth.showtime_builder.dto.FilmRequest;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/films")
@Validated
public class FilmController {

    private final CatalogService catalogService;

    public FilmController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    // sorted by priority, then title
    @GetMapping
    public List<Film> getAll() {
        return catalogService.getAllFilms();
    }

    @GetMapping("/{id}")
    public Film get(@PathVariable String id) {
        return catalogService.getFilm(id);
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public Film create(@Valid @RequestBody FilmRequest request) {
        return catalogService.createFilm(request);
    }

    @PutMapping("/{id}")
    public Film update(@PathVariable String id, @Valid @RequestBody FilmRequest request) {
        return catalogService.updateFilm(id, request);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        catalogService.deleteFilm(id);
    }
}
