package com.koni.energy.domain.model;

/**
 * Lifecycle of one batch from intake to a settled outcome.
 *
 * RECEIVED → VALIDATING → CLASSIFYING → WRITING → SETTLED on success.
 * Any unrecoverable error moves the batch to FAILED; the platform re-delivers it
 * (back to RECEIVED) until the retry budget is spent, after which it is DEAD_LETTERED.
 */
public enum BatchState {
    RECEIVED,
    VALIDATING,
    CLASSIFYING,
    WRITING,
    SETTLED,
    FAILED,
    DEAD_LETTERED
}
