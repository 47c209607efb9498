package com.koni.energy.application.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.koni.energy.application.port.BatchContentStore;
import com.koni.energy.application.port.BatchIntakePublisher;
import com.koni.energy.domain.event.BatchIntakeEvent;
import com.koni.energy.domain.model.RawReading;
import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Generates mock batches of energy readings for the configured sites, hands them to storage
 * and announces them to the pipeline.
 *
 * Every site gets between {@code min-readings-per-site} and {@code max-readings-per-site}
 * readings, stepping back from now by {@code reading-interval}. With
 * {@code anomaly-probability} all readings of a site are anomalous: either consumption
 * exceeds generation, or generation reaches the configured ceiling.
 */
@Slf4j
@Service
public class BatchSimulationService {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd-HH-mm-ss").withZone(ZoneOffset.UTC);

    private final BatchContentStore contentStore;
    private final BatchIntakePublisher batchIntakePublisher;
    private final ObjectMapper objectMapper;
    private final EnergyPipelineProperties properties;
    private final Clock clock;
    private final Random random;

    @Autowired
    public BatchSimulationService(BatchContentStore contentStore,
                                  BatchIntakePublisher batchIntakePublisher,
                                  ObjectMapper objectMapper,
                                  EnergyPipelineProperties properties,
                                  Clock clock) {
        this(contentStore, batchIntakePublisher, objectMapper, properties, clock, new Random());
    }

    BatchSimulationService(BatchContentStore contentStore,
                           BatchIntakePublisher batchIntakePublisher,
                           ObjectMapper objectMapper,
                           EnergyPipelineProperties properties,
                           Clock clock,
                           Random random) {
        this.contentStore = contentStore;
        this.batchIntakePublisher = batchIntakePublisher;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
        this.random = random;
    }

    /**
     * Generates one batch, stores it and publishes its intake event.
     *
     * @return the stored batch
     * @throws com.koni.energy.domain.exception.BatchStoreException if the batch cannot be stored
     * @throws RuntimeException if the intake event cannot be published
     */
    public SimulatedBatch simulate() {
        EnergyPipelineProperties.Simulation simulation = properties.getSimulation();
        Instant now = Instant.now(clock).truncatedTo(ChronoUnit.MILLIS);

        ArrayNode batch = objectMapper.createArrayNode();
        List<String> anomalousSites = new ArrayList<>();

        for (String siteId : simulation.getSites()) {
            int readings = readingsForSite(simulation);
            boolean anomalous = random.nextDouble() < simulation.getAnomalyProbability();
            boolean spike = random.nextBoolean();
            if (anomalous) {
                anomalousSites.add(siteId);
            }
            for (int i = 0; i < readings; i++) {
                Instant timestamp = now.minus(simulation.getReadingInterval().multipliedBy(i));
                batch.add(anomalous ? anomalousReading(siteId, timestamp, spike) : normalReading(siteId, timestamp));
            }
        }

        String batchName = "raw/energy_data_" + FILE_TIMESTAMP.format(now) + ".json";
        String locator = contentStore.store(batchName, serialize(batch));
        batchIntakePublisher.publish(BatchIntakeEvent.firstDelivery(locator));

        log.info("Simulated batch published: batchLocator={}, sites={}, readings={}, anomalousSites={}",
                locator, simulation.getSites().size(), batch.size(), anomalousSites);
        return new SimulatedBatch(locator, batch.size(), anomalousSites);
    }

    private int readingsForSite(EnergyPipelineProperties.Simulation simulation) {
        int min = simulation.getMinReadingsPerSite();
        int max = Math.max(min, simulation.getMaxReadingsPerSite());
        return random.nextInt(min, max + 1);
    }

    private ObjectNode normalReading(String siteId, Instant timestamp) {
        double generated = random.nextDouble(50.0, 500.0);
        double consumed = random.nextDouble(10.0, generated * 0.8);
        return reading(siteId, timestamp, kwh(generated), kwh(consumed));
    }

    private ObjectNode anomalousReading(String siteId, Instant timestamp, boolean spike) {
        if (spike) {
            BigDecimal ceiling = properties.getAnomaly().getMaxReadingKwh();
            BigDecimal generated = ceiling.multiply(BigDecimal.valueOf(random.nextDouble(1.0, 1.5)))
                    .setScale(2, RoundingMode.UP);
            return reading(siteId, timestamp, generated, kwh(random.nextDouble(20.0, 80.0)));
        }
        double generated = random.nextDouble(10.0, 50.0);
        double consumed = random.nextDouble(60.0, 120.0);
        return reading(siteId, timestamp, kwh(generated), kwh(consumed));
    }

    private ObjectNode reading(String siteId, Instant timestamp, BigDecimal generated, BigDecimal consumed) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put(RawReading.SITE_ID, siteId);
        node.put(RawReading.TIMESTAMP, timestamp.toString());
        node.put(RawReading.ENERGY_GENERATED_KWH, generated);
        node.put(RawReading.ENERGY_CONSUMED_KWH, consumed);
        return node;
    }

    private static BigDecimal kwh(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP);
    }

    private String serialize(ArrayNode batch) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(batch);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Simulated batch could not be serialized", e);
        }
    }
}
