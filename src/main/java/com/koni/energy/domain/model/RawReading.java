package com.koni.energy.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.MissingNode;
import lombok.Getter;

/**
 * One untrusted entry of an intake batch, exactly as it arrived.
 * Field values are kept as raw JSON nodes; nothing about their type or
 * content is assumed until the validator has looked at them.
 */
@Getter
public final class RawReading {

    public static final String SITE_ID = "site_id";
    public static final String TIMESTAMP = "timestamp";
    public static final String ENERGY_GENERATED_KWH = "energy_generated_kwh";
    public static final String ENERGY_CONSUMED_KWH = "energy_consumed_kwh";

    private final int index;
    private final JsonNode siteId;
    private final JsonNode timestamp;
    private final JsonNode energyGeneratedKwh;
    private final JsonNode energyConsumedKwh;

    public RawReading(int index, JsonNode siteId, JsonNode timestamp,
                      JsonNode energyGeneratedKwh, JsonNode energyConsumedKwh) {
        this.index = index;
        this.siteId = orMissing(siteId);
        this.timestamp = orMissing(timestamp);
        this.energyGeneratedKwh = orMissing(energyGeneratedKwh);
        this.energyConsumedKwh = orMissing(energyConsumedKwh);
    }

    /**
     * Creates a raw reading from one element of the batch array.
     * Elements that are not JSON objects yield a reading with every field missing.
     *
     * @param index position of the element in the batch
     * @param entry the JSON element
     * @return the raw reading
     */
    public static RawReading fromJson(int index, JsonNode entry) {
        if (entry == null || !entry.isObject()) {
            return new RawReading(index, null, null, null, null);
        }
        return new RawReading(
                index,
                entry.get(SITE_ID),
                entry.get(TIMESTAMP),
                entry.get(ENERGY_GENERATED_KWH),
                entry.get(ENERGY_CONSUMED_KWH)
        );
    }

    private static JsonNode orMissing(JsonNode node) {
        return node == null ? MissingNode.getInstance() : node;
    }

    @Override
    public String toString() {
        return "RawReading{" +
                "index=" + index +
                ", siteId=" + siteId +
                ", timestamp=" + timestamp +
                ", energyGeneratedKwh=" + energyGeneratedKwh +
                ", energyConsumedKwh=" + energyConsumedKwh +
                '}';
    }
}
