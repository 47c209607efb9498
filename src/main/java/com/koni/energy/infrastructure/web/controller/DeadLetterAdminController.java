package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.service.DeadLetterService;
import com.koni.energy.infrastructure.web.dto.DeadLetterResponse;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * REST controller for dead-letter administration.
 * Batches land here after exhausting their retries; operators inspect and replay them.
 *
 * Endpoints:
 * - GET /api/v1/admin/dead-letters: list captured batches, oldest first
 * - POST /api/v1/admin/dead-letters/replay: replay every captured batch
 * - POST /api/v1/admin/dead-letters/{id}/replay: replay one captured batch
 */
@RestController
@RequestMapping("/api/v1/admin")
@RequiredArgsConstructor
@Slf4j
public class DeadLetterAdminController {

    private final DeadLetterService deadLetterService;

    @GetMapping("/dead-letters")
    public ResponseEntity<List<DeadLetterResponse>> listDeadLetters() {
        log.info("Received request to list dead letters");

        List<DeadLetterResponse> deadLetters = deadLetterService.list().stream()
                .map(DeadLetterResponse::from)
                .collect(Collectors.toList());

        log.info("Returning {} dead letters", deadLetters.size());
        return ResponseEntity.ok(deadLetters);
    }

    /**
     * Example response (202 Accepted):
     * {
     *   "message": "Replayed 2 dead letters",
     *   "replayedCount": 2
     * }
     *
     * @return 202 Accepted with the number of envelopes replayed
     */
    @PostMapping("/dead-letters/replay")
    public ResponseEntity<Map<String, Object>> replayAll() {
        log.info("Received request to replay all dead letters");

        int replayedCount = deadLetterService.replayAll();

        String message = replayedCount > 0
                ? String.format("Replayed %d dead letters", replayedCount)
                : "No dead letters replayed";

        return ResponseEntity.accepted().body(Map.of(
                "message", message,
                "replayedCount", replayedCount
        ));
    }

    /**
     * @param id the envelope id
     * @return 202 Accepted if the envelope was replayed, 404 if no envelope has that id
     */
    @PostMapping("/dead-letters/{id}/replay")
    public ResponseEntity<Map<String, Object>> replayOne(@PathVariable("id") UUID id) {
        log.info("Received request to replay dead letter: id={}", id);

        return deadLetterService.replay(id)
                .<ResponseEntity<Map<String, Object>>>map(envelope -> ResponseEntity.accepted().body(Map.of(
                        "message", "Replayed dead letter " + envelope.getId(),
                        "replayedCount", 1
                )))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }
}
