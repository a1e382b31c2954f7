package com.wangbin.liveprobe.api.controller;

import com.wangbin.liveprobe.common.domain.entity.Sample;
import com.wangbin.liveprobe.common.domain.enums.ClosureReason;
import com.wangbin.liveprobe.core.store.TimeSeriesStore;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(properties = "probe.poller.auto-start=false")
@AutoConfigureMockMvc
class SessionControllerTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private TimeSeriesStore store;

    @AfterEach
    void tearDown() {
        store.purgeAll();
    }

    @Test
    void listAndGetSession() throws Exception {
        long id = openWithSamples("cam-1", 3);

        mockMvc.perform(get("/api/sessions").param("deviceId", "cam-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.code").value(200))
                .andExpect(jsonPath("$.data", hasSize(1)))
                .andExpect(jsonPath("$.data[0].sessionId").value(id))
                .andExpect(jsonPath("$.extra.count").value(1));

        mockMvc.perform(get("/api/sessions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.deviceId").value("cam-1"))
                .andExpect(jsonPath("$.data.sampleCount").value(3))
                .andExpect(jsonPath("$.data.open").value(true));
    }

    @Test
    void unknownSessionIs404() throws Exception {
        mockMvc.perform(get("/api/sessions/{id}", 424242))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value(2100))
                .andExpect(jsonPath("$.extra.sessionId").value(424242));
    }

    @Test
    void readSamplesPagesByIndex() throws Exception {
        long id = openWithSamples("cam-1", 5);

        mockMvc.perform(get("/api/sessions/{id}/samples", id).param("fromIndex", "2").param("limit", "2"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.samples", hasSize(2)))
                .andExpect(jsonPath("$.data.samples[0].sequenceIndex").value(2))
                .andExpect(jsonPath("$.data.nextIndex").value(4))
                .andExpect(jsonPath("$.data.closed").value(false));

        mockMvc.perform(get("/api/sessions/{id}/samples", id).param("limit", "0"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void rangeUsesIsoInstants() throws Exception {
        long id = openWithSamples("cam-1", 5);

        mockMvc.perform(get("/api/sessions/{id}/range", id)
                        .param("from", "2024-05-01T10:00:10Z")
                        .param("to", "2024-05-01T10:00:15Z"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data", hasSize(2)))
                .andExpect(jsonPath("$.data[0].sequenceIndex").value(2));

        mockMvc.perform(get("/api/sessions/{id}/range", id)
                        .param("from", "2024-05-01T10:00:15Z")
                        .param("to", "2024-05-01T10:00:10Z"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void stopRenameAndDelete() throws Exception {
        long id = openWithSamples("cam-1", 2);

        mockMvc.perform(post("/api/sessions/{id}/stop", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.closureReason").value(ClosureReason.MANUAL.name()))
                .andExpect(jsonPath("$.data.endTime").value("2024-05-01T10:00:05Z"));

        mockMvc.perform(post("/api/sessions/{id}/stop", id))
                .andExpect(status().isConflict());

        mockMvc.perform(post("/api/sessions/{id}/title", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"title\": \" Evening news \"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.title").value("Evening news"));

        mockMvc.perform(delete("/api/sessions/{id}", id))
                .andExpect(status().isOk());
        mockMvc.perform(delete("/api/sessions/{id}", id))
                .andExpect(status().isNotFound());
    }

    @Test
    void purgeAllReturnsCount() throws Exception {
        openWithSamples("cam-1", 1);
        openWithSamples("cam-2", 1);

        mockMvc.perform(delete("/api/sessions"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data").value(2));
    }

    @Test
    void pollerControlAndHealth() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));

        mockMvc.perform(post("/api/poller/start"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.running").value(true));
        mockMvc.perform(get("/health/snapshot"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.pollerRunning").value(true));
        mockMvc.perform(post("/api/poller/stop"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message", containsString("停止")));

        mockMvc.perform(get("/api/devices/{id}", "nope"))
                .andExpect(status().isNotFound());
    }

    private long openWithSamples(String deviceId, int count) {
        long id = store.openSession(deviceId, deviceId, "SST-1", T0).getSessionId();
        for (int i = 0; i < count; i++) {
            store.append(id, Sample.builder().deviceId(deviceId).timestamp(T0.plusSeconds(i * 5L)).build());
        }
        return id;
    }
}
