package com.ntth.showtime_builder.repository;

import com.ntth.showtime_builder.pojo.Auditorium;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface AuditoriumRepository extends MongoRepository<Auditorium, Integer> {
    Optional<Auditorium> findTopByOrderByIdDesc();
}
