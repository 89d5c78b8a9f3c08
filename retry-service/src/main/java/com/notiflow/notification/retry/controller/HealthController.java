package com.notiflow.notification.retry.controller;

import com.notiflow.notification.retry.usecase.CheckHealthUseCase;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

@RestController
@RequiredArgsConstructor
@Slf4j
public class HealthController {

    private final CheckHealthUseCase checkHealthUseCase;

    @GetMapping("/health")
    public ResponseEntity<Map<String, String>> health() {
        Map<String, String> response = new LinkedHashMap<>();
        try {
            checkHealthUseCase.checkHealth();
            response.put("status", "UP");
            return ResponseEntity.ok(response);
        } catch (RuntimeException e) {
            log.warn("Health check failed: {}", e.getMessage());
            response.put("status", "DOWN");
            response.put("error", e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName());
            return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(response);
        }
    }
}
