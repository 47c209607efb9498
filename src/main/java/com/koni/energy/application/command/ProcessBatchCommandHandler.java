package com.koni.energy.application.command;

import com.koni.energy.application.port.AlertPublisher;
import com.koni.energy.application.port.BatchContentSource;
import com.koni.energy.domain.event.AlertEvent;
import com.koni.energy.domain.exception.AlertDispatchException;
import com.koni.energy.domain.exception.BatchWriteException;
import com.koni.energy.domain.exception.ClassificationException;
import com.koni.energy.domain.model.BatchState;
import com.koni.energy.domain.model.Classification;
import com.koni.energy.domain.model.EnergyRecord;
import com.koni.energy.domain.model.RawReading;
import com.koni.energy.domain.model.ReadingValidationResult;
import com.koni.energy.domain.model.ValidatedReading;
import com.koni.energy.domain.model.WriteOutcome;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import com.koni.energy.domain.service.AnomalyClassifier;
import com.koni.energy.domain.service.ReadingValidator;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import com.koni.energy.infrastructure.observability.EnergyPipelineMetrics;
import io.micrometer.observation.annotation.Observed;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Command handler for processing one batch of energy readings.
 * This handler implements the write side of the pipeline.
 *
 * Responsibilities:
 * - Fetch the batch contents from the content source
 * - Validate every entry, dropping malformed ones
 * - Classify valid readings and derive net energy
 * - Upsert the resulting records, one store transaction per record
 * - Dispatch one alert per stored anomalous record
 *
 * The handler keeps no state between invocations. If any record fails to persist the whole
 * batch fails with {@link BatchWriteException} so the platform re-delivers it; rewriting the
 * records that did succeed is harmless because writes overwrite by key.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ProcessBatchCommandHandler {

    private final BatchContentSource contentSource;
    private final BatchPayloadParser payloadParser;
    private final ReadingValidator readingValidator;
    private final AnomalyClassifier anomalyClassifier;
    private final EnergyRecordRepository energyRecordRepository;
    private final AlertPublisher alertPublisher;
    private final EnergyPipelineMetrics metrics;
    private final EnergyPipelineProperties properties;

    /**
     * Handles the ProcessBatchCommand.
     *
     * @param command the batch to process
     * @return the settled outcome of the batch
     * @throws com.koni.energy.domain.exception.BatchProcessingException if the batch cannot be
     *         fetched, is not a JSON array, or one or more records failed to persist
     */
    @Observed(name = "batch.handler", contextualName = "process-batch")
    public BatchResult handle(ProcessBatchCommand command) {
        metrics.recordBatchReceived();
        try {
            return metrics.recordProcessingTime(() -> process(command));
        } catch (RuntimeException e) {
            metrics.recordBatchFailed();
            log.error("Batch state transition: batchLocator={}, state={}, deliveryAttempt={}, error={}",
                    command.getBatchLocator(), BatchState.FAILED, command.getDeliveryAttempt(), e.getMessage());
            throw e;
        }
    }

    private BatchResult process(ProcessBatchCommand command) {
        String batchLocator = command.getBatchLocator();
        logTransition(batchLocator, BatchState.RECEIVED);

        String content = contentSource.fetch(batchLocator);

        logTransition(batchLocator, BatchState.VALIDATING);
        List<RawReading> rawReadings = payloadParser.parse(batchLocator, content);
        List<ReadingValidationResult> validationResults = readingValidator.validate(rawReadings);

        int skipped = 0;
        List<ValidatedReading> candidates = new ArrayList<>(validationResults.size());
        for (ReadingValidationResult result : validationResults) {
            if (result.isValid()) {
                candidates.add(result.getReading());
            } else {
                skipped++;
                log.warn("Skipping malformed entry: batchLocator={}, index={}, reason={}",
                        batchLocator, result.getIndex(), result.getError());
            }
        }

        logTransition(batchLocator, BatchState.CLASSIFYING);
        List<EnergyRecord> records = new ArrayList<>(candidates.size());
        List<Classification> classifications = new ArrayList<>(candidates.size());
        for (ValidatedReading reading : candidates) {
            try {
                Classification classification = anomalyClassifier.classify(
                        reading.getEnergyGeneratedKwh(), reading.getEnergyConsumedKwh());
                records.add(EnergyRecord.classified(reading, classification));
                classifications.add(classification);
            } catch (ClassificationException e) {
                skipped++;
                log.error("Dropping record that could not be classified: batchLocator={}, siteId={}, timestamp={}, reason={}",
                        batchLocator, reading.getSiteId(), reading.getTimestamp(), e.getMessage());
            }
        }

        logTransition(batchLocator, BatchState.WRITING);
        List<WriteOutcome> outcomes = energyRecordRepository.upsertAll(records);

        int persisted = 0;
        int anomalies = 0;
        int alertsDispatched = 0;
        int alertsFailed = 0;
        int writeFailures = 0;
        String firstWriteError = null;
        boolean alertsEnabled = properties.getAlerts().isEnabled();

        for (int i = 0; i < outcomes.size(); i++) {
            WriteOutcome outcome = outcomes.get(i);
            EnergyRecord record = outcome.getRecord();
            if (!outcome.isSuccess()) {
                writeFailures++;
                if (firstWriteError == null) {
                    firstWriteError = outcome.getError();
                }
                log.error("Record failed to persist: batchLocator={}, siteId={}, timestamp={}, error={}",
                        batchLocator, record.getSiteId(), record.getTimestamp(), outcome.getError());
                continue;
            }
            persisted++;
            log.debug("Record persisted: batchLocator={}, siteId={}, timestamp={}, netEnergyKwh={}, anomaly={}",
                    batchLocator, record.getSiteId(), record.getTimestamp(), record.getNetEnergyKwh(), record.isAnomaly());

            if (record.isAnomaly()) {
                anomalies++;
                metrics.recordAnomalyDetected();
                if (!alertsEnabled) {
                    log.debug("Alert dispatch disabled, not publishing: siteId={}, timestamp={}",
                            record.getSiteId(), record.getTimestamp());
                } else if (dispatchAlert(AlertEvent.forRecord(record, classifications.get(i), batchLocator))) {
                    alertsDispatched++;
                } else {
                    alertsFailed++;
                }
            }
        }

        metrics.recordRecordsPersisted(persisted);
        metrics.recordRecordsSkipped(skipped);

        if (writeFailures > 0) {
            throw new BatchWriteException(batchLocator, writeFailures, firstWriteError);
        }

        BatchResult result = new BatchResult(batchLocator, BatchState.SETTLED, rawReadings.size(),
                persisted, skipped, anomalies, alertsDispatched, alertsFailed);
        metrics.recordBatchSettled();
        log.info("Batch state transition: batchLocator={}, state={}, entries={}, persisted={}, skipped={}, anomalies={}, alertsDispatched={}, alertsFailed={}",
                batchLocator, BatchState.SETTLED, result.getTotalEntries(), persisted, skipped,
                anomalies, alertsDispatched, alertsFailed);
        return result;
    }

    private boolean dispatchAlert(AlertEvent alert) {
        try {
            alertPublisher.publish(alert);
            metrics.recordAlertDispatched();
            log.info("Anomaly alert dispatched: batchLocator={}, siteId={}, timestamp={}, reason={}",
                    alert.getBatchLocator(), alert.getSiteId(), alert.getTimestamp(), alert.getReason());
            return true;
        } catch (AlertDispatchException e) {
            metrics.recordAlertFailed();
            log.warn("Anomaly alert could not be dispatched: batchLocator={}, siteId={}, timestamp={}, error={}",
                    alert.getBatchLocator(), alert.getSiteId(), alert.getTimestamp(), e.getMessage());
            return false;
        }
    }

    private void logTransition(String batchLocator, BatchState state) {
        log.info("Batch state transition: batchLocator={}, state={}", batchLocator, state);
    }
}
