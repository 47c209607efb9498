package com.koni.energy.infrastructure.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.koni.energy.application.service.SimulatedBatch;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * DTO describing a simulated batch that was stored and announced.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SimulatedBatchResponse {

    @JsonProperty("batch_locator")
    private String batchLocator;

    @JsonProperty("total_readings")
    private int totalReadings;

    @JsonProperty("anomalous_sites")
    private List<String> anomalousSites;

    public static SimulatedBatchResponse from(SimulatedBatch batch) {
        return new SimulatedBatchResponse(batch.getBatchLocator(), batch.getTotalReadings(), batch.getAnomalousSites());
    }
}
