package com.koni.energy.domain.service;

import com.koni.energy.domain.exception.ClassificationException;
import com.koni.energy.domain.model.AnomalyThresholds;
import com.koni.energy.domain.model.Classification;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Derives net energy and flags anomalous readings.
 *
 * A reading is anomalous when its net energy is below the configured floor, or when
 * either the generated or the consumed value reaches the configured ceiling.
 * The classifier holds no state beyond its thresholds and is safe to share.
 */
public class AnomalyClassifier {

    private final AnomalyThresholds thresholds;

    public AnomalyClassifier(AnomalyThresholds thresholds) {
        this.thresholds = Objects.requireNonNull(thresholds, "thresholds is required");
    }

    /**
     * @param energyGeneratedKwh generated energy, must be non-null and non-negative
     * @param energyConsumedKwh consumed energy, must be non-null and non-negative
     * @return the classification
     * @throws ClassificationException if an input breaks the validated-reading invariants
     */
    public Classification classify(BigDecimal energyGeneratedKwh, BigDecimal energyConsumedKwh) {
        requireNonNegative(energyGeneratedKwh, "energy generated");
        requireNonNegative(energyConsumedKwh, "energy consumed");

        BigDecimal net = energyGeneratedKwh.subtract(energyConsumedKwh);
        List<String> reasons = new ArrayList<>(3);

        if (net.compareTo(thresholds.getNetEnergyFloorKwh()) < 0) {
            reasons.add("net energy " + net.toPlainString() + " kWh below floor "
                    + thresholds.getNetEnergyFloorKwh().toPlainString() + " kWh");
        }
        if (energyGeneratedKwh.compareTo(thresholds.getMaxReadingKwh()) >= 0) {
            reasons.add(ceilingReason("energy generated", energyGeneratedKwh));
        }
        if (energyConsumedKwh.compareTo(thresholds.getMaxReadingKwh()) >= 0) {
            reasons.add(ceilingReason("energy consumed", energyConsumedKwh));
        }
        return new Classification(net, reasons);
    }

    public AnomalyThresholds getThresholds() {
        return thresholds;
    }

    private String ceilingReason(String label, BigDecimal value) {
        return label + " " + value.toPlainString() + " kWh at or above ceiling "
                + thresholds.getMaxReadingKwh().toPlainString() + " kWh";
    }

    private static void requireNonNegative(BigDecimal value, String label) {
        if (value == null) {
            throw new ClassificationException(label + " is missing");
        }
        if (value.signum() < 0) {
            throw new ClassificationException(label + " is negative: " + value.toPlainString());
        }
    }
}
