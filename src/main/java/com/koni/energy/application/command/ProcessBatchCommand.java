package com.koni.energy.application.command;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Command to process one batch of energy readings.
 */
@Getter
@ToString
@AllArgsConstructor
public class ProcessBatchCommand {

    /**
     * Opaque reference to the batch contents.
     */
    @NotBlank(message = "batchLocator is required")
    private final String batchLocator;

    /**
     * Delivery attempt announced by the producer of the intake event.
     */
    private final int deliveryAttempt;
}
