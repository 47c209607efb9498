package com.koni.energy.application.port;

import com.koni.energy.domain.event.AlertEvent;

/**
 * Port interface for fanning out anomaly alerts.
 * This interface follows the Hexagonal Architecture pattern, defining an output port
 * that is implemented by infrastructure adapters (e.g., Kafka publisher).
 */
public interface AlertPublisher {

    /**
     * Publishes one alert.
     *
     * @param event the alert to publish
     * @throws com.koni.energy.domain.exception.AlertDispatchException if the alert could not be published
     */
    void publish(AlertEvent event);
}
