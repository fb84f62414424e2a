package com.ntth.showtime_builder.repository;

import com.ntth.showtime_builder.pojo.Film;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface FilmRepository extends MongoRepository<Film, String> {
}
