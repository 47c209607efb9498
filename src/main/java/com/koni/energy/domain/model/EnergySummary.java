package com.koni.energy.domain.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.List;
import java.util.Map;

/**
 * Aggregate view over every stored record.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class EnergySummary {

    private final long totalRecords;
    private final long anomalyCount;
    private final List<String> siteIds;
    private final Map<String, Long> siteAnomalyDistribution;

    public EnergySummary(long totalRecords, long anomalyCount, List<String> siteIds,
                         Map<String, Long> siteAnomalyDistribution) {
        this.totalRecords = totalRecords;
        this.anomalyCount = anomalyCount;
        this.siteIds = List.copyOf(siteIds);
        this.siteAnomalyDistribution = Map.copyOf(siteAnomalyDistribution);
    }

    public int getTotalSites() {
        return siteIds.size();
    }
}
