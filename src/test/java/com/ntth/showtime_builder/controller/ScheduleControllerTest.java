package com.ntth.showtime_builder.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ntth.showtime_builder.Config.ShowtimeProperties;
import com.ntth.showtime_builder.dto.ShowMapper;
import com.ntth.showtime_builder.pojo.RowRef;
import com.ntth.showtime_builder.pojo.ScheduleRow;
import com.ntth.showtime_builder.pojo.Show;
import com.ntth.showtime_builder.pojo.ShowSource;
import com.ntth.showtime_builder.service.ScheduleService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.SpringBootConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.patch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = ScheduleController.class, properties = "showtime.zone=UTC")
@AutoConfigureMockMvc(addFilters = false)
class ScheduleControllerTest {

    @SpringBootConfiguration
    @Import({ScheduleController.class, ShowMapper.class, ShowtimeProperties.class, GlobalExceptionHandler.class})
    static class TestApplication {}

    @Autowired
    MockMvc mockMvc;

    @Autowired
    ObjectMapper objectMapper;

    @MockBean
    ScheduleService scheduleService;

    @BeforeEach
    void setup() {
        Mockito.reset(scheduleService);
    }

    private static Show show(String id, ShowSource source, RowRef rowRef) {
        Instant start = Instant.parse("2025-08-19T19:05:00Z");
        return Show.builder()
                .id(id)
                .rowRef(rowRef)
                .offset(0)
                .audId(2)
                .audName("Aud 2")
                .filmId("F1")
                .filmTitle("Thunder Road")
                .start(start)
                .end(start.plusSeconds(135 * 60))
                .runtimeMin(120)
                .trailerMin(15)
                .cleanMin(15)
                .cycleMinutes(150)
                .source(source)
                .build();
    }

    @Test
    void shows_areRenderedWithWallClockTimes() throws Exception {
        when(scheduleService.shows()).thenReturn(List.of(show("R1:0", ShowSource.OVERRIDE, new RowRef.Dynamic(2, "F1"))));

        mockMvc.perform(get("/api/schedule/shows"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].id").value("R1:0"))
                .andExpect(jsonPath("$[0].rowId").value("OV-2-F1"))
                .andExpect(jsonPath("$[0].start").value("19:05"))
                .andExpect(jsonPath("$[0].end").value("21:20"))
                .andExpect(jsonPath("$[0].nextAvailable").value("21:35"))
                .andExpect(jsonPath("$[0].source").value("Override"));
    }

    @Test
    void setStart_passesTimeThrough() throws Exception {
        when(scheduleService.setStart("R1:0", "19:05"))
                .thenReturn(List.of(show("R1:0", ShowSource.PRIME, new RowRef.Static("R1"))));

        mockMvc.perform(put("/api/schedule/shows/{id}/start", "R1:0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("start", "19:05"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].rowId").value("R1"))
                .andExpect(jsonPath("$[0].source").value("Prime"));
    }

    @Test
    void setStart_rejectsMalformedTime() throws Exception {
        mockMvc.perform(put("/api/schedule/shows/{id}/start", "R1:0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("start", "7pm"))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.start").exists());
        verify(scheduleService, never()).setStart(any(), any());
    }

    @Test
    void emptyStart_hidesShow() throws Exception {
        when(scheduleService.setStart("R1:0", "")).thenReturn(List.of());

        mockMvc.perform(put("/api/schedule/shows/{id}/start", "R1:0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":\"\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$").isEmpty());
    }

    @Test
    void nudge_forwardsDirection() throws Exception {
        when(scheduleService.nudge("R1:0", -1)).thenReturn(List.of());

        mockMvc.perform(post("/api/schedule/shows/{id}/nudge", "R1:0").param("direction", "-1"))
                .andExpect(status().isOk());
        verify(scheduleService).nudge("R1:0", -1);
    }

    @Test
    void nudge_withNonNumericDirection_is400() throws Exception {
        mockMvc.perform(post("/api/schedule/shows/{id}/nudge", "R1:0").param("direction", "later"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.details.direction").value("later"));
        verify(scheduleService, never()).nudge(any(), anyInt());
    }

    @Test
    void malformedJson_is400() throws Exception {
        mockMvc.perform(put("/api/schedule/shows/{id}/start", "R1:0")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"start\":"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed request body"));
    }

    @Test
    void removeExtraRow_unknown_is404() throws Exception {
        when(scheduleService.removeExtraRow("EX-9")).thenReturn(false);

        mockMvc.perform(delete("/api/schedule/rows/{id}", "EX-9"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Extra row not found"));
    }

    @Test
    void patchRow_routesByField() throws Exception {
        ScheduleRow row = new ScheduleRow("PRB-B1", "B1", "1", "F1", 3, "19:00");
        when(scheduleService.setRowAuditorium("PRB-B1", 3)).thenReturn(Optional.of(row));

        mockMvc.perform(patch("/api/schedule/rows/{id}", "PRB-B1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("field", "audId", "value", "3"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.audId").value(3));
    }

    @Test
    void patchRow_unknownField_is400() throws Exception {
        mockMvc.perform(patch("/api/schedule/rows/{id}", "PRB-B1")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content(objectMapper.writeValueAsString(Map.of("field", "slot", "value", "3"))))
                .andExpect(status().isBadRequest());
    }

    @Test
    void clearTimes_returnsNoContent() throws Exception {
        mockMvc.perform(post("/api/schedule/clear-times"))
                .andExpect(status().isNoContent());
        verify(scheduleService).clearAllTimes();
    }
}
