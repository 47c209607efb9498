package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.port.BatchIntakePublisher;
import com.koni.energy.application.service.BatchSimulationService;
import com.koni.energy.application.service.SimulatedBatch;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.infrastructure.web.dto.BatchSubmissionRequest;
import com.koni.energy.infrastructure.web.dto.SimulatedBatchResponse;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST controller for announcing batches by hand.
 *
 * Endpoints:
 * - POST /api/v1/batches: publish an intake event for the given locator
 * - POST /api/v1/batches/simulate: generate a mock batch, store it and publish its intake event
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class BatchIntakeController {

    private final BatchIntakePublisher batchIntakePublisher;
    private final BatchSimulationService batchSimulationService;

    /**
     * Example request:
     * POST /api/v1/batches
     * {
     *   "batch_locator": "2024-01-01/batch-0001.json"
     * }
     *
     * @param request the batch to announce
     * @return 202 Accepted once the intake event is on the topic
     */
    @PostMapping("/v1/batches")
    public ResponseEntity<Void> submitBatch(@RequestBody @Valid BatchSubmissionRequest request) {
        log.info("Received batch submission: batchLocator={}", request.getBatchLocator());

        batchIntakePublisher.publish(BatchIntakeEvent.firstDelivery(request.getBatchLocator()));

        // Processing happens asynchronously in the intake consumer
        return ResponseEntity.accepted().build();
    }

    /**
     * Example response (202 Accepted):
     * {
     *   "batch_locator": "raw/energy_data_2024-01-01-00-00-00.json",
     *   "total_readings": 47,
     *   "anomalous_sites": ["site-beta-wind-turbine-03"]
     * }
     *
     * @return 202 Accepted once the simulated batch is stored and announced
     */
    @PostMapping("/v1/batches/simulate")
    public ResponseEntity<SimulatedBatchResponse> simulateBatch() {
        log.info("Received batch simulation request");

        SimulatedBatch batch = batchSimulationService.simulate();

        return ResponseEntity.accepted().body(SimulatedBatchResponse.from(batch));
    }
}
