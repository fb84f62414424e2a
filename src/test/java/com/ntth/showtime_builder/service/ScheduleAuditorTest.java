package com.ntth.showtime_builder.service;

import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.service.ScheduleAuditor.AuditReport;
import com.ntth.showtime_builder.service.ScheduleAuditor.OrderLine;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.ntth.showtime_builder.service.EngineFixtures.row;
import static com.ntth.showtime_builder.service.EngineFixtures.session;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class ScheduleAuditorTest {

    private final ShowResolver resolver = new ShowResolver(new CycleGenerator());
    private final ScheduleAuditor auditor = new ScheduleAuditor(new DowntimeAnalyzer());

    @Test
    void audit_groupsByFilmAndAuditorium() {
        ScheduleSession session = session(row("R1", "F1", 1, "19:00"), row("R2", "F1", 2, "19:15"));
        List<Show> shows = resolver.resolve(session);

        AuditReport report = auditor.audit(session, shows);

        assertThat(report.housePlacement()).singleElement().satisfies(h -> {
            assertThat(h.film()).isEqualTo("Thunder Road");
            assertThat(h.houses()).containsExactly("Aud 1 (200)", "Aud 2 (190)");
        });
        assertThat(report.perFeature()).singleElement().satisfies(f -> {
            assertThat(f.prints()).isEqualTo(2);
            assertThat(f.shows()).isEqualTo(shows.size());
            assertThat(f.firstShow()).isEqualTo("9:00am");
        });
        assertThat(report.perAuditorium()).extracting(ScheduleAuditor.AuditoriumSummary::auditorium, ScheduleAuditor.AuditoriumSummary::seats)
                .containsExactly(tuple("Aud 1", 200), tuple("Aud 2", 190));
        // 19:00 in Aud 1 and 19:15 in Aud 2 are 15 minutes apart
        assertThat(report.byFilm()).anySatisfy(l -> {
            assertThat(l.start()).isEqualTo("7:00pm");
            assertThat(l.gapToNext()).isEqualTo("0:15");
            assertThat(l.shortGap()).isTrue();
        });
    }

    @Test
    void startTimeOrder_reportsCleanTimeToNextShowInSameAuditorium() {
        ScheduleSession session = session(row("R1", "F1", 1, "19:00"));
        List<OrderLine> lines = auditor.startTimeOrder(session, resolver.resolve(session));

        OrderLine first = lines.get(0);
        assertThat(first.cleanMinutes()).isEqualTo(15L);
        assertThat(first.cleanGap()).isEqualTo("15m");
        assertThat(first.shortClean()).isTrue();
        assertThat(lines.get(lines.size() - 1).cleanMinutes()).isNull();
    }

    @Test
    void flaggedCounts_tallyByKind() {
        ScheduleSession session = session(row("R1", "F2", 1, "20:00"));
        session.snapshot().getHiddenShows().add("R1:-2");

        var counts = auditor.flaggedCounts(auditor.issues(session, resolver.resolve(session)));

        assertThat(counts.hugeGap()).isEqualTo(1);
        assertThat(counts.gap()).isZero();
    }
}
