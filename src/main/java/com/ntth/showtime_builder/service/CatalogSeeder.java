package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.repository.AuditoriumRepository;
import com.ntth.showtime_builder.repository.BookingRepository;
import com.ntth.showtime_builder.repository.FilmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/** Demo catalog for an empty database: six auditoriums, three films, three bookings. */
@Component
public class CatalogSeeder implements CommandLineRunner {
    private static final Logger log = LoggerFactory.getLogger(CatalogSeeder.class);

    private final AuditoriumRepository auditoriumRepository;
    private final FilmRepository filmRepository;
    private final BookingRepository bookingRepository;
    private final CatalogService catalogService;
    private final ShowtimeProperties props;

    public CatalogSeeder(AuditoriumRepository auditoriumRepository, FilmRepository filmRepository,
                         BookingRepository bookingRepository, CatalogService catalogService,
                         ShowtimeProperties props) {
        this.auditoriumRepository = auditoriumRepository;
        this.filmRepository = filmRepository;
        this.bookingRepository = bookingRepository;
        this.catalogService = catalogService;
        this.props = props;
    }

    @Override
    public void run(String... args) {
        if (!props.isSeedDefaults() || auditoriumRepository.count() > 0 || filmRepository.count() > 0) {
            return;
        }
        auditoriumRepository.saveAll(List.of(
                new Auditorium(1, "Aud 1", "Standard", 200),
                new Auditorium(2, "Aud 2", "Standard", 190),
                new Auditorium(3, "Aud 3", "3D", 150),
                new Auditorium(4, "Aud 4", "Laser", 210),
                new Auditorium(5, "Aud 5", "Standard", 140),
                new Auditorium(6, "Aud 6", "Standard", 140)));
        filmRepository.saveAll(List.of(
                new Film("F1", "Thunder Road", "PG-13", 124, 18, 20, 1.0, ""),
                new Film("F2", "Moon Harbor", "R", 108, 16, 20, 2.0, ""),
                new Film("F3", "Galaxy Kids 3D", "PG", 97, 15, 15, 3.0, "")));
        bookingRepository.saveAll(List.of(
                new Booking("B1", 34, "1", "F1", "", 1),
                new Booking("B2", 34, "2", "F2", "", 1),
                new Booking("B3", 34, "3", "F3", "", 1)));
        catalogService.resyncPrimeRows();
        log.info("Seeded demo catalog: 6 auditoriums, 3 films, 3 bookings");
    }
}
