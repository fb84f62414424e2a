package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.dto.AuditoriumRequest;
import com.ntth.showtime_builder.dto.BookingRequest;
import com.ntth.showtime_builder.dto.FilmRequest;
import com.ntth.showtime_builder.pojo.Auditorium;
import com.ntth.showtime_builder.pojo.Booking;
import com.ntth.showtime_builder.pojo.Film;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.ScheduleSnapshot;
import com.ntth.showtime_builder.pojo.ShowOverride;
import com.ntth.showtime_builder.repository.AuditoriumRepository;
import com.ntth.showtime_builder.repository.BookingRepository;
import com.ntth.showtime_builder.repository.FilmRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.UnaryOperator;

/**
 * Auditorium, film and booking CRUD. Deletions clean up every stored schedule date,
 * and booking changes re-derive the prime rows of the active date.
 */
@Service
public class CatalogService {
    private static final Logger log = LoggerFactory.getLogger(CatalogService.class);

    private final AuditoriumRepository auditoriumRepository;
    private final FilmRepository filmRepository;
    private final BookingRepository bookingRepository;
    private final ScheduleService scheduleService;

    public CatalogService(AuditoriumRepository auditoriumRepository, FilmRepository filmRepository,
                          BookingRepository bookingRepository, ScheduleService scheduleService) {
        this.auditoriumRepository = auditoriumRepository;
        this.filmRepository = filmRepository;
        this.bookingRepository = bookingRepository;
        this.scheduleService = scheduleService;
    }

    // ---- auditoriums ----

    public List<Auditorium> getAllAuditoriums() {
        return auditoriumRepository.findAll(Sort.by("id").ascending());
    }

    public Auditorium getAuditorium(Integer id) {
        return auditoriumRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Auditorium not found"));
    }

    /** Next id after the highest one; missing fields default to "Aud N", Standard, 100 seats. */
    public Auditorium createAuditorium(AuditoriumRequest r) {
        int id = auditoriumRepository.findTopByOrderByIdDesc().map(Auditorium::getId).orElse(0) + 1;
        Auditorium a = new Auditorium(id,
                isBlank(r.name()) ? "Aud " + id : r.name(),
                isBlank(r.format()) ? "Standard" : r.format(),
                r.seats() == null ? 100 : r.seats());
        log.info("Created auditorium {} ({})", id, a.getName());
        return auditoriumRepository.save(a);
    }

    public Auditorium updateAuditorium(Integer id, AuditoriumRequest r) {
        Auditorium a = getAuditorium(id);
        if (!isBlank(r.name())) a.setName(r.name());
        if (r.format() != null) a.setFormat(r.format());
        if (r.seats() != null) a.setSeats(r.seats());
        return auditoriumRepository.save(a);
    }

    /** Rows on the auditorium become unassigned and overrides moving shows into it are dropped. */
    public void deleteAuditorium(Integer id) {
        if (!auditoriumRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Auditorium not found");
        }
        auditoriumRepository.deleteById(id);
        scheduleService.updateAllSnapshots(snap -> {
            snap.allRows().stream().filter(r -> id.equals(r.getAudId())).forEach(r -> r.setAudId(null));
            stripOverrides(snap, ov -> id.equals(ov.audId()) ? ov.withAudId(null) : ov);
        });
        log.info("Deleted auditorium {} and cleared its references", id);
    }

    // ---- films ----

    public List<Film> getAllFilms() {
        return filmRepository.findAll().stream()
                .sorted(Comparator.comparing((Film f) -> f.getPriority() == null ? Double.MAX_VALUE : f.getPriority())
                        .thenComparing(f -> f.getTitle() == null ? "" : f.getTitle()))
                .toList();
    }

    public Film getFilm(String id) {
        return filmRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Film not found"));
    }

    public Film createFilm(FilmRequest r) {
        Film f = new Film();
        f.setId("F" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1000));
        apply(f, r);
        log.info("Created film {} ({})", f.getId(), f.getTitle());
        return filmRepository.save(f);
    }

    public Film updateFilm(String id, FilmRequest r) {
        Film f = getFilm(id);
        apply(f, r);
        Film saved = filmRepository.save(f);
        resyncPrimeRows();
        return saved;
    }

    /** Rows lose the film, overrides naming it are dropped, bookings of it are unlinked. */
    public void deleteFilm(String id) {
        if (!filmRepository.existsById(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Film not found");
        }
        filmRepository.deleteById(id);
        for (Booking b : bookingRepository.findByFilmId(id)) {
            b.setFilmId(null);
            bookingRepository.save(b);
        }
        scheduleService.updateAllSnapshots(snap -> {
            snap.allRows().stream().filter(r -> id.equals(r.getFilmId())).forEach(r -> r.setFilmId(null));
            stripOverrides(snap, ov -> id.equals(ov.filmId()) ? ov.withFilmId(null) : ov);
        });
        resyncPrimeRows();
        log.info("Deleted film {} and cleared its references", id);
    }

    private static void apply(Film f, FilmRequest r) {
        f.setTitle(r.title());
        f.setRating(r.rating());
        f.setRuntimeMin(r.runtimeMin());
        f.setTrailerMin(r.trailerMin() == null ? 0 : r.trailerMin());
        f.setCleanMin(r.cleanMin() == null ? 0 : r.cleanMin());
        f.setPriority(r.priority());
        f.setFormat(r.format() == null ? "" : r.format());
    }

    // ---- bookings ----

    public List<Booking> getAllBookings() {
        return bookingRepository.findAll().stream()
                .sorted(Comparator.comparing((Booking b) -> slotNumber(b.getSlot()))
                        .thenComparing(b -> Objects.toString(b.getSlot(), "")))
                .toList();
    }

    public Booking createBooking(BookingRequest r) {
        requireFilm(r.filmId());
        Booking b = new Booking("B" + System.currentTimeMillis() + "-" + ThreadLocalRandom.current().nextInt(1000),
                r.week(), r.slot(), r.filmId(), r.notes(), r.weeksOut() == null ? 1 : r.weeksOut());
        Booking saved = bookingRepository.save(b);
        resyncPrimeRows();
        return saved;
    }

    public Booking updateBooking(String id, BookingRequest r) {
        Booking b = bookingRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Booking not found"));
        requireFilm(r.filmId());
        b.setWeek(r.week());
        b.setSlot(r.slot());
        b.setFilmId(r.filmId());
        b.setNotes(r.notes());
        if (r.weeksOut() != null) b.setWeeksOut(r.weeksOut());
        Booking saved = bookingRepository.save(b);
        resyncPrimeRows();
        return saved;
    }

    /**
     * Removes the booking with its row's manual shows and overrides. Its film goes too
     * when nothing else books or schedules it.
     */
    public void deleteBooking(String id) {
        Booking removed = bookingRepository.findById(id)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND, "Booking not found"));
        bookingRepository.deleteById(id);
        scheduleService.updateAllSnapshots(snap -> {
            String rowId = snap.getPrimeRows().stream()
                    .filter(r -> id.equals(r.getBookingId()))
                    .map(ScheduleRow::getRowId)
                    .findFirst().orElse("PRB-" + id);
            snap.forgetRow(rowId);
        });

        String filmId = removed.getFilmId();
        if (filmId != null && !bookingRepository.existsByFilmId(filmId)
                && !scheduleService.anySnapshot(snap -> usesFilm(snap, filmId))) {
            filmRepository.deleteById(filmId);
            log.info("Deleted film {} with its last booking", filmId);
        }
        resyncPrimeRows();
    }

    /** Drops every booking and empties the schedule of every date; auditoriums and films stay. */
    public void clearBookingsAndTimes() {
        bookingRepository.deleteAll();
        scheduleService.clearAllSchedules();
        log.info("Cleared all bookings and schedules");
    }

    public void resyncPrimeRows() {
        scheduleService.syncPrimeRows(bookingRepository.findAll());
    }

    private void requireFilm(String filmId) {
        if (filmId != null && !filmId.isBlank() && !filmRepository.existsById(filmId)) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Film with ID " + filmId + " does not exist");
        }
    }

    private static boolean usesFilm(ScheduleSnapshot snap, String filmId) {
        return snap.getExtraRows().stream().anyMatch(r -> filmId.equals(r.getFilmId()))
                || snap.getManualShows().stream().anyMatch(m -> filmId.equals(m.getFilmId()));
    }

    private static void stripOverrides(ScheduleSnapshot snap, UnaryOperator<ShowOverride> strip) {
        for (String showId : List.copyOf(snap.getOverrides().keySet())) {
            snap.patchOverride(showId, strip);
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }

    private static int slotNumber(String slot) {
        try {
            return slot == null ? Integer.MAX_VALUE : Integer.parseInt(slot.trim());
        } catch (NumberFormatException e) {
            return Integer.MAX_VALUE;
        }
    }
}
