package com.phillippitts.readaloud.presentation.controller;

import com.phillippitts.readaloud.service.orchestration.PipelineOrchestrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.Map;

/**
 * Lightweight liveness endpoint. Its request passes through the MDC filter, so the log line
 * shows the request id.
 */
@RestController
class PingController {

    private static final Logger log = LogManager.getLogger(PingController.class);

    private final PipelineOrchestrator orchestrator;

    PingController(PipelineOrchestrator orchestrator) {
        this.orchestrator = orchestrator;
    }

    @GetMapping("/ping")
    ResponseEntity<Map<String, Object>> ping() {
        int active = orchestrator.activeSessions().size();
        log.info("Ping received, {} active session(s)", active);
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "activeSessions", active,
                "timestamp", Instant.now().toString()
        ));
    }
}
