package com.example.recordsapi.health;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
public class HealthController {

    private final Clock clock;
    private final String appName;

    public HealthController(Clock clock,
                            @Value("${records.display-name:Records API}") String appName) {
        this.clock = clock;
        this.appName = appName;
    }

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "OK",
                "message", appName + " is running",
                "timestamp", Instant.now(clock).toString()
        ));
    }
}
