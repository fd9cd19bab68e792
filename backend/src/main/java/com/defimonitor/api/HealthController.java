package com.defimonitor.api;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final MongoTemplate mongoTemplate;
    private final Clock clock;

    /** 200 when MongoDB answers a ping, 503 otherwise. */
    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        try {
            mongoTemplate.executeCommand("{ ping: 1 }");
            body.put("status", "healthy");
            body.put("timestamp", clock.instant().toString());
            return ResponseEntity.ok(body);
        } catch (Exception e) {
            log.error("Health check failed: {}", e.getMessage());
            body.put("status", "unhealthy");
            body.put("error", e.getMessage());
            body.put("timestamp", clock.instant().toString());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
        }
    }
}
