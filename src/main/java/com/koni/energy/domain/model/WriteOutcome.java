package com.koni.energy.domain.model;

import lombok.Getter;
import lombok.ToString;

/**
 * Per-record result of a store write. Batch writes report one outcome per record
 * so the orchestrator can tell exactly which records did not make it.
 */
@Getter
@ToString
public final class WriteOutcome {

    private final EnergyRecord record;
    private final boolean success;
    private final String error;

    private WriteOutcome(EnergyRecord record, boolean success, String error) {
        this.record = record;
        this.success = success;
        this.error = error;
    }

    public static WriteOutcome succeeded(EnergyRecord record) {
        return new WriteOutcome(record, true, null);
    }

    public static WriteOutcome failed(EnergyRecord record, String error) {
        return new WriteOutcome(record, false, error);
    }
}
