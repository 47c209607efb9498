package com.koni.energy.application.query;

import com.koni.energy.domain.model.EnergySummary;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.TreeMap;

/**
 * Query handler for the aggregate summary.
 * This handler implements part of the read side and never touches the processing path.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetSummaryQueryHandler {

    private final EnergyRecordRepository repository;

    /**
     * @param query the query object (contains no parameters)
     * @return totals over every stored record; zero counts and empty lists when nothing is stored
     */
    @Transactional(readOnly = true)
    public SummaryResponse handle(GetSummaryQuery query) {
        log.debug("Handling GetSummaryQuery");

        EnergySummary summary = repository.summarize();

        log.info("Summary computed: totalRecords={}, anomalyCount={}, totalSites={}",
                summary.getTotalRecords(), summary.getAnomalyCount(), summary.getTotalSites());

        return new SummaryResponse(
                summary.getTotalRecords(),
                summary.getAnomalyCount(),
                summary.getSiteIds(),
                summary.getTotalSites(),
                new TreeMap<>(summary.getSiteAnomalyDistribution())
        );
    }
}
