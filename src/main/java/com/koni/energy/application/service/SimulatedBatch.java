package com.koni.energy.application.service;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;

/**
 * Outcome of one simulated batch: where it was stored and what it contains.
 */
@Getter
@ToString
@RequiredArgsConstructor
public class SimulatedBatch {

    private final String batchLocator;
    private final int totalReadings;
    private final List<String> anomalousSites;
}
