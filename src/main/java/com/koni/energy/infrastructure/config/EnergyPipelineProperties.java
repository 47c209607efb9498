package com.koni.energy.infrastructure.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Tunables of the energy pipeline, bound from the {@code energy.*} namespace.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "energy")
public class EnergyPipelineProperties {

    @Valid
    @NotNull
    private Anomaly anomaly = new Anomaly();

    @Valid
    @NotNull
    private Pipeline pipeline = new Pipeline();

    @Valid
    @NotNull
    private Alerts alerts = new Alerts();

    @Valid
    @NotNull
    private Storage storage = new Storage();

    @Valid
    @NotNull
    private Kafka kafka = new Kafka();

    @Valid
    @NotNull
    private Simulation simulation = new Simulation();

    @Data
    public static class Anomaly {
        /**
         * Net energy strictly below this floor is anomalous.
         */
        @NotNull
        private BigDecimal netEnergyFloorKwh = BigDecimal.ZERO;

        /**
         * Generated or consumed energy at or above this ceiling is anomalous.
         */
        @NotNull
        @DecimalMin(value = "0", inclusive = false)
        private BigDecimal maxReadingKwh = new BigDecimal("10000");
    }

    @Data
    public static class Pipeline {
        /**
         * Upper bound of a single record's store transaction.
         */
        @NotNull
        private Duration writeTimeout = Duration.ofSeconds(5);

        @Valid
        @NotNull
        private Retry retry = new Retry();
    }

    @Data
    public static class Retry {
        @NotNull
        private Duration initialInterval = Duration.ofSeconds(1);

        @DecimalMin("1.0")
        private double multiplier = 2.0;

        /**
         * Re-deliveries after the first attempt before a batch is dead-lettered.
         */
        @Min(0)
        private int maxRetries = 3;
    }

    @Data
    public static class Alerts {
        private boolean enabled = true;

        @NotNull
        private Duration publishTimeout = Duration.ofSeconds(10);

        @Valid
        @NotNull
        private CircuitBreaker circuitBreaker = new CircuitBreaker();
    }

    @Data
    public static class CircuitBreaker {
        @Min(1)
        private int slidingWindowSize = 10;

        @Min(1)
        private int minimumNumberOfCalls = 5;

        private float failureRateThreshold = 50.0f;

        @NotNull
        private Duration waitDurationInOpenState = Duration.ofSeconds(60);

        @Min(1)
        private int permittedNumberOfCallsInHalfOpenState = 3;
    }

    @Data
    public static class Storage {
        /**
         * Root directory the local batch content source resolves locators against.
         */
        @NotBlank
        private String baseDir = "./batches";
    }

    @Data
    public static class Kafka {
        @NotBlank
        private String intakeTopic = "energy.batches.intake";

        @NotBlank
        private String alertTopic = "energy.alerts";

        @Min(1)
        private int partitions = 3;

        @Min(1)
        private int replicationFactor = 1;

        @Min(1)
        private int concurrency = 3;

        private boolean createTopics = true;

        @Valid
        @NotNull
        private Listener listener = new Listener();
    }

    @Data
    public static class Listener {
        private boolean autoStartup = true;
    }

    @Data
    public static class Simulation {
        @NotEmpty
        private List<String> sites = new ArrayList<>(List.of(
                "site-alpha-pv-farm-01",
                "site-beta-wind-turbine-03",
                "site-gamma-hydro-plant-01",
                "site-delta-solar-roof-02",
                "site-epsilon-geothermal-01"));

        @Min(1)
        private int minReadingsPerSite = 5;

        @Min(1)
        private int maxReadingsPerSite = 15;

        /**
         * Chance that all readings of a site in one batch are anomalous.
         */
        @DecimalMin("0.0")
        @DecimalMax("1.0")
        private double anomalyProbability = 0.1;

        /**
         * Gap between consecutive readings of a site, stepping back from now.
         */
        @NotNull
        private Duration readingInterval = Duration.ofSeconds(15);
    }
}
