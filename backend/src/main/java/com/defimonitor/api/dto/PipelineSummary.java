package com.defimonitor.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Data;

import java.util.Map;

/**
 * Outcome of one monitoring pipeline run.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PipelineSummary {

    public static final String SUCCESS = "success";
    public static final String PARTIAL_FAILURE = "partial_failure";
    public static final String FAILED = "failed";

    @JsonProperty("run_id")
    private String runId;
    @JsonProperty("start_time")
    private String startTime;
    @JsonProperty("end_time")
    private String endTime;
    @JsonProperty("duration_seconds")
    private double durationSeconds;

    private String status;

    /** protocol id -> whether a new snapshot was stored */
    @JsonProperty("ingestion_results")
    private Map<String, Boolean> ingestionResults;

    /** protocol id -> number of anomalies detected */
    @JsonProperty("anomaly_results")
    private Map<String, Integer> anomalyResults;

    private String error;
}
