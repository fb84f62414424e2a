package com.ntth.showtime_builder.pojo;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/** A single show punched in by hand on a row; edited in place, never through an override. */
@Data
@NoArgsConstructor
public class ManualShow {
    private String id;
    private String rowId;
    private Integer audId;
    private String audName;
    private String filmId;
    private String filmTitle;
    private Instant start;
    private Instant end;
    private int runtimeMin;
    private int trailerMin;
    private int cleanMin;
    private int cycleMinutes;

    public ManualShow(ManualShow other) {
        this.id = other.id;
        this.rowId = other.rowId;
        this.audId = other.audId;
        this.audName = other.audName;
        this.filmId = other.filmId;
        this.filmTitle = other.filmTitle;
        this.start = other.start;
        this.end = other.end;
        this.runtimeMin = other.runtimeMin;
        this.trailerMin = other.trailerMin;
        this.cleanMin = other.cleanMin;
        this.cycleMinutes = other.cycleMinutes;
    }

    /** Copies the film fields and recomputes the end from the current start. */
    public void assignFilm(Film film) {
        this.filmId = film.getId();
        this.filmTitle = film.displayTitle();
        this.runtimeMin = film.getRuntimeMin() == null ? 0 : film.getRuntimeMin();
        this.trailerMin = film.getTrailerMin() == null ? 0 : film.getTrailerMin();
        this.cleanMin = film.getCleanMin() == null ? 0 : film.getCleanMin();
        this.cycleMinutes = film.cycleMinutes();
        this.end = start == null ? null : start.plusSeconds(60L * film.showMinutes());
    }

    public void clearFilm() {
        this.filmId = null;
        this.filmTitle = "";
        this.runtimeMin = 0;
        this.trailerMin = 0;
        this.cleanMin = 0;
        this.cycleMinutes = 0;
        this.end = start;
    }
}
