package com.resumeparse.api.controller;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Liveness endpoints for load balancers and uptime monitors.
 */
@RestController
@RequestMapping("/api/v1/health")
public class HealthController {
    
    private final AtomicLong requestCount = new AtomicLong();
    private final Instant startTime = Instant.now();
    
    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        requestCount.incrementAndGet();
        
        Map<String, Object> response = new HashMap<>();
        response.put("status", "UP");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "resumeparse");
        response.put("uptime", getUptime());
        response.put("requestCount", requestCount.get());
        return ResponseEntity.ok(response);
    }
    
    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        requestCount.incrementAndGet();
        return ResponseEntity.ok("pong");
    }
    
    private String getUptime() {
        long seconds = Instant.now().getEpochSecond() - startTime.getEpochSecond();
        long hours = seconds / 3600;
        long minutes = (seconds % 3600) / 60;
        long secs = seconds % 60;
        
        if (hours > 0) {
            return String.format("%dh %dm %ds", hours, minutes, secs);
        } else if (minutes > 0) {
            return String.format("%dm %ds", minutes, secs);
        }
        return String.format("%ds", secs);
    }
}
