package com.ntth.showtime_builder.dto;

import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.util.TimeUtils;
import org.springframework.stereotype.Component;

import java.time.ZoneId;
import java.util.List;

@Component
public class ShowMapper {
    private final ZoneId zone;

    public ShowMapper(ShowtimeProperties props) {
        this.zone = props.zoneId();
    }

    public ShowResponse toResponse(Show s) {
        String start = s.start() == null ? null : TimeUtils.hmOf(s.start(), zone);
        String end = s.end() == null ? null : TimeUtils.hmOf(s.end(), zone);
        String next = s.start() == null ? null : TimeUtils.hmOf(s.nextAvailable(), zone);
        return new ShowResponse(
                s.id(), s.rowId(), s.audId(), s.audName(), s.filmId(), s.filmTitle(),
                start, end, s.start(), s.end(), next,
                s.runtimeMin(), s.trailerMin(), s.cleanMin(), s.cycleMinutes(),
                s.source().getLabel()
        );
    }

    public List<ShowResponse> toResponses(List<Show> shows) {
        return shows.stream().map(this::toResponse).toList();
    }
}
