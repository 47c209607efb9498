package com.koni.energy.application.query;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Data Transfer Object for the aggregate view over all stored records.
 */
@Getter
@NoArgsConstructor
@AllArgsConstructor
public class SummaryResponse {

    @JsonProperty("total_records")
    private long totalRecords;

    @JsonProperty("anomaly_count")
    private long anomalyCount;

    @JsonProperty("site_ids")
    private List<String> siteIds;

    @JsonProperty("total_sites")
    private int totalSites;

    @JsonProperty("site_anomaly_distribution")
    private Map<String, Long> siteAnomalyDistribution;
}
