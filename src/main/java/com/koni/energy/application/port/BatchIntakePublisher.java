package com.koni.energy.application.port;

import com.koni.energy.domain.event.BatchIntakeEvent;

/**
 * Port interface for announcing a batch to the pipeline.
 * Used by manual submission and by dead-letter replay.
 */
public interface BatchIntakePublisher {

    /**
     * @param event the intake event to publish
     * @throws RuntimeException if the event could not be handed to the transport
     */
    void publish(BatchIntakeEvent event);
}
