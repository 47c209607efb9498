package com.koni.energy.infrastructure.resilience;

import com.koni.energy.infrastructure.config.EnergyPipelineProperties;
import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for the circuit breaker guarding alert dispatch.
 *
 * Circuit Breaker States:
 * - CLOSED: Normal operation, alerts are published
 * - OPEN: Failure threshold exceeded, alert dispatch fails fast
 * - HALF_OPEN: Testing if the broker recovered, limited publishes allowed
 */
@Slf4j
@Configuration
public class CircuitBreakerConfiguration {

    public static final String ALERTS_CIRCUIT_BREAKER = "alerts";

    /**
     * Builds the breaker settings from {@code energy.alerts.circuit-breaker.*}.
     */
    @Bean
    public CircuitBreakerConfig alertCircuitBreakerConfig(EnergyPipelineProperties properties) {
        EnergyPipelineProperties.CircuitBreaker settings = properties.getAlerts().getCircuitBreaker();
        return CircuitBreakerConfig.custom()
            .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
            .slidingWindowSize(settings.getSlidingWindowSize())
            .minimumNumberOfCalls(settings.getMinimumNumberOfCalls())
            .failureRateThreshold(settings.getFailureRateThreshold())
            .waitDurationInOpenState(settings.getWaitDurationInOpenState())
            .permittedNumberOfCallsInHalfOpenState(settings.getPermittedNumberOfCallsInHalfOpenState())
            .automaticTransitionFromOpenToHalfOpenEnabled(true)
            .build();
    }

    @Bean
    public CircuitBreakerRegistry circuitBreakerRegistry(CircuitBreakerConfig config) {
        return CircuitBreakerRegistry.of(config);
    }

    /**
     * Creates the "alerts" circuit breaker and logs its state transitions.
     */
    @Bean
    public CircuitBreaker alertCircuitBreaker(CircuitBreakerRegistry registry) {
        CircuitBreaker circuitBreaker = registry.circuitBreaker(ALERTS_CIRCUIT_BREAKER);
        circuitBreaker.getEventPublisher()
                .onStateTransition(event ->
                        log.warn("Circuit breaker state transition: name={}, {} -> {} (failure rate: {}%)",
                                event.getCircuitBreakerName(),
                                event.getStateTransition().getFromState(),
                                event.getStateTransition().getToState(),
                                circuitBreaker.getMetrics().getFailureRate()))
                .onCallNotPermitted(event ->
                        log.warn("Circuit breaker call not permitted (circuit is OPEN): name={}",
                                event.getCircuitBreakerName()));
        return circuitBreaker;
    }
}
