package com.koni.energy.infrastructure.config;

import com.koni.energy.domain.model.AnomalyThresholds;
import com.koni.energy.domain.service.AnomalyClassifier;
import com.koni.energy.domain.service.ReadingValidator;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Wires the framework-free domain services with their configured thresholds.
 */
@Slf4j
@Configuration
public class PipelineConfiguration {

    @Bean
    public AnomalyThresholds anomalyThresholds(EnergyPipelineProperties properties) {
        AnomalyThresholds thresholds = new AnomalyThresholds(
                properties.getAnomaly().getNetEnergyFloorKwh(),
                properties.getAnomaly().getMaxReadingKwh());
        log.info("Anomaly thresholds: netEnergyFloorKwh={}, maxReadingKwh={}",
                thresholds.getNetEnergyFloorKwh(), thresholds.getMaxReadingKwh());
        return thresholds;
    }

    @Bean
    public AnomalyClassifier anomalyClassifier(AnomalyThresholds anomalyThresholds) {
        return new AnomalyClassifier(anomalyThresholds);
    }

    @Bean
    public ReadingValidator readingValidator() {
        return new ReadingValidator();
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }
}
