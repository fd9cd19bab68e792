package com.defimonitor.api;

import com.defimonitor.api.dto.PipelineSummary;
import com.defimonitor.detection.AlertCandidate;
import com.defimonitor.service.DetectionOrchestrator;
import com.defimonitor.service.MonitoringPipeline;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/**
 * Manual triggers for the scheduled work.
 */
@RestController
@RequestMapping("/api/v1")
@RequiredArgsConstructor
public class MonitorController {

    private final MonitoringPipeline pipeline;
    private final DetectionOrchestrator detectionOrchestrator;

    @PostMapping("/pipeline/run")
    public PipelineSummary runPipeline() {
        return pipeline.run();
    }

    @PostMapping("/detection/run")
    public Map<String, List<AlertCandidate>> runDetection() {
        return detectionOrchestrator.detectAll();
    }

    @PostMapping("/detection/{protocolId}/run")
    public List<AlertCandidate> runDetection(@PathVariable String protocolId) {
        return detectionOrchestrator.detectOne(protocolId);
    }
}
