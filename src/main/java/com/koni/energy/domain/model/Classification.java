package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.math.BigDecimal;
import java.util.List;

/**
 * Result of classifying a reading: the derived net energy, the anomaly flag
 * and the rules that fired.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class Classification {

    private final BigDecimal netEnergyKwh;
    private final boolean anomaly;
    private final List<String> reasons;

    public Classification(BigDecimal netEnergyKwh, List<String> reasons) {
        this.netEnergyKwh = netEnergyKwh;
        this.reasons = List.copyOf(reasons);
        this.anomaly = !this.reasons.isEmpty();
    }

    /**
     * @return the fired rules joined into one human-readable sentence, or an empty string
     */
    public String reasonText() {
        return String.join("; ", reasons);
    }
}
