package com.defimonitor.api;

import com.defimonitor.api.dto.PipelineSummary;
import com.defimonitor.exception.ConfigurationException;
import com.defimonitor.model.AlertKind;
import com.defimonitor.service.DetectionOrchestrator;
import com.defimonitor.service.MonitoringPipeline;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.Map;

import static com.defimonitor.fixtures.MonitorFixtures.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class MonitorControllerTest {

    private MonitoringPipeline pipeline;
    private DetectionOrchestrator detection;
    private MongoTemplate mongoTemplate;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        pipeline = mock(MonitoringPipeline.class);
        detection = mock(DetectionOrchestrator.class);
        mongoTemplate = mock(MongoTemplate.class);
        mockMvc = MockMvcBuilders
                .standaloneSetup(new MonitorController(pipeline, detection), new HealthController(mongoTemplate, CLOCK))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @Test
    void runPipeline_returnsSummary() throws Exception {
        given(pipeline.run()).willReturn(PipelineSummary.builder()
                .runId(NOW.toString())
                .status(PipelineSummary.PARTIAL_FAILURE)
                .ingestionResults(Map.of(AAVE, false))
                .anomalyResults(Map.of(AAVE, 1))
                .build());

        mockMvc.perform(post("/api/v1/pipeline/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("partial_failure"))
                .andExpect(jsonPath("$.ingestion_results['aave-v3']").value(false))
                .andExpect(jsonPath("$.anomaly_results['aave-v3']").value(1))
                .andExpect(jsonPath("$.error").doesNotExist());
    }

    @Test
    void runDetection_returnsCandidatesPerProtocol() throws Exception {
        given(detection.detectAll()).willReturn(Map.of(AAVE, List.of(candidate(AAVE, AlertKind.APY_LOW))));

        mockMvc.perform(post("/api/v1/detection/run"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$['aave-v3'][0].kind").value("APY_LOW"));
    }

    @Test
    void runDetectionForUnknownProtocol_isNotFound() throws Exception {
        given(detection.detectOne("nope")).willThrow(new ConfigurationException("Unknown protocol: nope"));

        mockMvc.perform(post("/api/v1/detection/nope/run"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.title").value("Protocol Not Found"));
    }

    @Test
    void health_okWhenMongoAnswers() throws Exception {
        given(mongoTemplate.executeCommand(anyString())).willReturn(new Document("ok", 1.0));

        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.timestamp").value("2026-10-19T12:00:00Z"));
    }

    @Test
    void health_unavailableWhenMongoIsDown() throws Exception {
        given(mongoTemplate.executeCommand(anyString())).willThrow(new DataAccessResourceFailureException("timed out"));

        mockMvc.perform(get("/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unhealthy"))
                .andExpect(jsonPath("$.error").value("timed out"));
    }
}
