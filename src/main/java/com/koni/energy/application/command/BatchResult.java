package com.koni.energy.application.command;

import com.koni.energy.domain.model.BatchState;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of one processing attempt of a batch.
 */
@Getter
@ToString
@AllArgsConstructor
public class BatchResult {

    private final String batchLocator;
    private final BatchState state;
    private final int totalEntries;
    private final int persisted;
    private final int skipped;
    private final int anomalies;
    private final int alertsDispatched;
    private final int alertsFailed;
}
