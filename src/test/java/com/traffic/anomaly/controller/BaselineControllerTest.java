package com.traffic.anomaly.controller;

import com.traffic.anomaly.exception.NoBaselineDataException;
import com.traffic.anomaly.model.Baseline;
import com.traffic.anomaly.model.BaselineCheck;
import com.traffic.anomaly.model.BaselineSnapshot;
import com.traffic.anomaly.model.TimeContext;
import com.traffic.anomaly.service.BaselineService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(BaselineController.class)
class BaselineControllerTest {

    private static final long TS = 1_704_639_600_000L; // 2024-01-07T15:00:00Z

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private BaselineService baselineService;

    @Test
    void listMetrics_success() throws Exception {
        when(baselineService.getMetricNames()).thenReturn(Set.of("rps"));

        mockMvc.perform(get("/api/v1/baselines"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("rps"));
    }

    @Test
    void recordObservation_usesGivenTimestamp() throws Exception {
        mockMvc.perform(post("/api/v1/baselines/rps/observations")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 42.0, \"timestamp\": " + TS + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.metric").value("rps"))
                .andExpect(jsonPath("$.timestamp").value(TS));

        verify(baselineService).recordObservation("rps", 42.0, TS);
    }

    @Test
    void getBaseline_found() throws Exception {
        Baseline baseline = Baseline.builder().mean(10.0).stddev(2.0).confidence(0.5).count(5).build();
        BaselineSnapshot snapshot = BaselineSnapshot.builder()
                .metric("rps").context(TimeContext.DAILY).bucket(0)
                .baseline(baseline).threshold(14.0).confidence(0.5)
                .build();
        when(baselineService.describe("rps", TS, TimeContext.DAILY)).thenReturn(Optional.of(snapshot));

        mockMvc.perform(get("/api/v1/baselines/rps")
                        .param("timestamp", String.valueOf(TS))
                        .param("context", "DAILY"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.context").value("DAILY"))
                .andExpect(jsonPath("$.baseline.mean").value(10.0))
                .andExpect(jsonPath("$.threshold").value(14.0))
                .andExpect(jsonPath("$.confidence").value(0.5));
    }

    @Test
    void getBaseline_noDataIsNotFound() throws Exception {
        when(baselineService.describe(eq("rps"), anyLong(), eq(TimeContext.HOURLY))).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/v1/baselines/rps"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void check_defaultsToHourlyContext() throws Exception {
        BaselineCheck result = BaselineCheck.builder()
                .metric("rps").value(99.0).threshold(20.0).confidence(1.0)
                .breached(true).context(TimeContext.HOURLY).bucket(15)
                .build();
        when(baselineService.check("rps", 99.0, TS, TimeContext.HOURLY)).thenReturn(result);

        mockMvc.perform(post("/api/v1/baselines/rps/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 99.0, \"timestamp\": " + TS + "}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.breached").value(true))
                .andExpect(jsonPath("$.bucket").value(15));
    }

    @Test
    void check_noDataIsNotFound() throws Exception {
        when(baselineService.check(eq("rps"), anyDouble(), anyLong(), eq(TimeContext.WEEKLY)))
                .thenThrow(new NoBaselineDataException(TimeContext.WEEKLY, 3));

        mockMvc.perform(post("/api/v1/baselines/rps/check")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"value\": 1.0, \"context\": \"WEEKLY\"}"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.context").value("WEEKLY"))
                .andExpect(jsonPath("$.bucket").value(3));
    }

    @Test
    void recentValues_success() throws Exception {
        when(baselineService.recentValues("rps")).thenReturn(List.of(1.0, 2.0));

        mockMvc.perform(get("/api/v1/baselines/rps/window"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(2));
    }

    @Test
    void exportWindow_returnsBytes() throws Exception {
        byte[] snapshot = {0, 0, 0, 0};
        when(baselineService.exportWindow("rps")).thenReturn(snapshot);

        mockMvc.perform(get("/api/v1/baselines/rps/window/snapshot"))
                .andExpect(status().isOk())
                .andExpect(content().contentType(MediaType.APPLICATION_OCTET_STREAM))
                .andExpect(content().bytes(snapshot));
    }

    @Test
    void importWindow_malformedIsBadRequest() throws Exception {
        byte[] snapshot = {0, 0, 0, 9};
        when(baselineService.importWindow("rps", snapshot))
                .thenThrow(new IllegalArgumentException("Malformed window snapshot for rps"));

        mockMvc.perform(put("/api/v1/baselines/rps/window/snapshot")
                        .contentType(MediaType.APPLICATION_OCTET_STREAM)
                        .content(snapshot))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Malformed window snapshot for rps"));
    }

    @Test
    void reset_unknownMetricIsNotFound() throws Exception {
        when(baselineService.reset("missing")).thenReturn(false);

        mockMvc.perform(delete("/api/v1/baselines/missing"))
                .andExpect(status().isNotFound());
    }

    @Test
    void updateSettings_rejectsInvalidLearningRate() throws Exception {
        when(baselineService.getSensitivity()).thenReturn(0.1);
        when(baselineService.getLearningRate()).thenReturn(0.05);

        mockMvc.perform(put("/api/v1/baselines/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"learningRate\": 0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.field").value("learningRate"));

        verify(baselineService, never()).updateSettings(anyDouble(), anyDouble());
    }

    @Test
    void updateSettings_success() throws Exception {
        when(baselineService.getSensitivity()).thenReturn(0.1);
        when(baselineService.getLearningRate()).thenReturn(0.05);
        when(baselineService.getZone()).thenReturn(ZoneOffset.UTC);

        mockMvc.perform(put("/api/v1/baselines/settings")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"sensitivity\": 3.0}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.zoneId").value("Z"));

        verify(baselineService).updateSettings(3.0, 0.05);
    }
}
