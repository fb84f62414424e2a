package com.ntth.showtime_builder.pojo;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** Read-only view of auditoriums and films for one engine call. Missing ids are not errors. */
public final class Catalog {

    private final Map<Integer, Auditorium> auditoriums = new LinkedHashMap<>();
    private final Map<String, Film> films = new LinkedHashMap<>();

    public Catalog(Collection<Auditorium> auditoriums, Collection<Film> films) {
        auditoriums.forEach(a -> this.auditoriums.put(a.getId(), a));
        films.forEach(f -> this.films.put(f.getId(), f));
    }

    public Optional<Film> filmById(String id) {
        return id == null ? Optional.empty() : Optional.ofNullable(films.get(id));
    }

    public Optional<Auditorium> auditoriumById(Integer id) {
        return id == null ? Optional.empty() : Optional.ofNullable(auditoriums.get(id));
    }
}
