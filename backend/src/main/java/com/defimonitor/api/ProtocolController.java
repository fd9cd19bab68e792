package com.defimonitor.api;

import com.defimonitor.api.dto.ProtocolStatusDTO;
import com.defimonitor.api.dto.SnapshotPointDTO;
import com.defimonitor.service.ProtocolStatusService;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Read-only endpoints for protocol status and snapshot history.
 */
@RestController
@RequestMapping("/api/v1/protocols")
@RequiredArgsConstructor
public class ProtocolController {

    private static final String DAYS_RANGE = "days must be between 1 and 365";

    private final ProtocolStatusService statusService;

    /** Latest metrics and health status of every configured protocol. */
    @GetMapping
    public List<ProtocolStatusDTO> protocols() {
        return statusService.currentStatus();
    }

    /**
     * Snapshots of the last {@code days} days, newest first.
     * Example: GET /api/v1/protocols/aave-v3/history?days=7
     */
    @GetMapping("/{id}/history")
    public List<SnapshotPointDTO> history(
            @PathVariable String id,
            @RequestParam(defaultValue = "30")
            @Min(value = 1, message = DAYS_RANGE) @Max(value = 365, message = DAYS_RANGE) int days
    ) {
        return statusService.history(id, days);
    }
}
