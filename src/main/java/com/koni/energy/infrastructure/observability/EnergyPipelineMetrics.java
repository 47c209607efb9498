package com.koni.energy.infrastructure.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.function.Supplier;

/**
 * Component for tracking pipeline-specific metrics.
 * Provides counters and timers for batches, records, alerts and dead letters.
 */
@Slf4j
@Component
public class EnergyPipelineMetrics {

    private final Counter batchesReceived;
    private final Counter batchesSettled;
    private final Counter batchesFailed;
    private final Counter recordsPersisted;
    private final Counter recordsSkipped;
    private final Counter anomaliesDetected;
    private final Counter alertsDispatched;
    private final Counter alertsFailed;
    private final Counter deadLettersCaptured;
    private final Counter deadLettersReplayed;
    private final Timer processingTime;

    public EnergyPipelineMetrics(MeterRegistry registry) {
        this.batchesReceived = Counter.builder("energy.batches.received.total")
                .description("Total batch intake events received")
                .register(registry);

        this.batchesSettled = Counter.builder("energy.batches.settled.total")
                .description("Total batches fully processed")
                .register(registry);

        this.batchesFailed = Counter.builder("energy.batches.failed.total")
                .description("Total batch processing attempts that failed")
                .register(registry);

        this.recordsPersisted = Counter.builder("energy.records.persisted.total")
                .description("Total energy records written to the store")
                .register(registry);

        this.recordsSkipped = Counter.builder("energy.records.skipped.total")
                .description("Total batch entries dropped by validation or classification")
                .register(registry);

        this.anomaliesDetected = Counter.builder("energy.anomalies.detected.total")
                .description("Total anomalous records detected")
                .register(registry);

        this.alertsDispatched = Counter.builder("energy.alerts.dispatched.total")
                .description("Total anomaly alerts published")
                .register(registry);

        this.alertsFailed = Counter.builder("energy.alerts.failed.total")
                .description("Total anomaly alerts that could not be published")
                .register(registry);

        this.deadLettersCaptured = Counter.builder("energy.deadletters.captured.total")
                .description("Total batches captured as dead letters")
                .register(registry);

        this.deadLettersReplayed = Counter.builder("energy.deadletters.replayed.total")
                .description("Total dead-lettered batches replayed")
                .register(registry);

        this.processingTime = Timer.builder("energy.batch.processing.time")
                .description("Time to process one batch")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
    }

    public void recordBatchReceived() {
        batchesReceived.increment();
        log.debug("Batch received counter incremented");
    }

    public void recordBatchSettled() {
        batchesSettled.increment();
        log.debug("Batch settled counter incremented");
    }

    public void recordBatchFailed() {
        batchesFailed.increment();
        log.debug("Batch failed counter incremented");
    }

    /**
     * @param count number of records written in one batch
     */
    public void recordRecordsPersisted(int count) {
        if (count > 0) {
            recordsPersisted.increment(count);
        }
    }

    /**
     * @param count number of entries dropped in one batch
     */
    public void recordRecordsSkipped(int count) {
        if (count > 0) {
            recordsSkipped.increment(count);
        }
    }

    public void recordAnomalyDetected() {
        anomaliesDetected.increment();
    }

    public void recordAlertDispatched() {
        alertsDispatched.increment();
    }

    public void recordAlertFailed() {
        alertsFailed.increment();
        log.debug("Alert failed counter incremented");
    }

    public void recordDeadLetterCaptured() {
        deadLettersCaptured.increment();
        log.debug("Dead letter captured counter incremented");
    }

    public void recordDeadLetterReplayed() {
        deadLettersReplayed.increment();
        log.debug("Dead letter replayed counter incremented");
    }

    /**
     * Record the processing time for a batch operation.
     *
     * @param operation The operation to time
     * @param <T> The return type of the operation
     * @return The result of the operation
     */
    public <T> T recordProcessingTime(Supplier<T> operation) {
        return processingTime.record(operation);
    }

    /**
     * Record the processing time for a void operation.
     *
     * @param operation The operation to time
     */
    public void recordProcessingTime(Runnable operation) {
        processingTime.record(operation);
    }
}
