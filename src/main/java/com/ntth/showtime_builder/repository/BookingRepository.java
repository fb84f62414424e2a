package com.ntth.showtime_builder.repository;

import com.ntth.showtime_builder.pojo.Booking;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BookingRepository extends MongoRepository<Booking, String> {
    List<Booking> findByFilmId(String filmId);

    boolean existsByFilmId(String filmId);
}
