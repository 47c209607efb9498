package com.koni.energy.domain.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * BatchIntakeEvent notification.
 * Published when a new batch is available; carries only the opaque locator of the batch
 * contents, never the contents themselves.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class BatchIntakeEvent {

    private final String batchLocator;
    private final int deliveryAttempt;

    /**
     * Creates a new BatchIntakeEvent.
     * This constructor is used by Jackson for JSON deserialization.
     *
     * @param batchLocator opaque reference to the batch contents
     * @param deliveryAttempt delivery attempt as seen by the producer, starting at 1
     */
    @JsonCreator
    public BatchIntakeEvent(
            @JsonProperty("batch_locator") String batchLocator,
            @JsonProperty("delivery_attempt") Integer deliveryAttempt) {
        this.batchLocator = batchLocator;
        this.deliveryAttempt = deliveryAttempt == null ? 1 : deliveryAttempt;
    }

    public static BatchIntakeEvent firstDelivery(String batchLocator) {
        return new BatchIntakeEvent(batchLocator, 1);
    }

    @JsonProperty("batch_locator")
    public String getBatchLocator() {
        return batchLocator;
    }

    @JsonProperty("delivery_attempt")
    public int getDeliveryAttempt() {
        return deliveryAttempt;
    }
}
