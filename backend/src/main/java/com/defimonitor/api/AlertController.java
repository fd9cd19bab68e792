package com.defimonitor.api;

import com.defimonitor.api.dto.AlertDTO;
import com.defimonitor.model.ProtocolAlert;
import com.defimonitor.service.AlertLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Locale;

@RestController
@RequestMapping("/api/v1/alerts")
@RequiredArgsConstructor
public class AlertController {

    private final AlertLedger alertLedger;

    /**
     * Alerts ordered by trigger time, newest first.
     * status: open (default, all of them) / resolved / all (latest 100 each).
     */
    @GetMapping
    public List<AlertDTO> alerts(@RequestParam(defaultValue = "open") String status) {
        List<ProtocolAlert> alerts = switch (status.toLowerCase(Locale.ROOT)) {
            case "open" -> alertLedger.open();
            case "resolved" -> alertLedger.resolved();
            case "all" -> alertLedger.all();
            default -> throw new IllegalArgumentException("status must be one of open, resolved, all");
        };
        return alerts.stream().map(AlertDTO::from).toList();
    }

    @PostMapping("/{id}/resolve")
    public AlertDTO resolve(@PathVariable String id) {
        return AlertDTO.from(alertLedger.resolve(id));
    }
}
