package com.koni.energy.application.query;

import com.koni.energy.domain.repository.EnergyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class GetSiteAnomaliesQueryHandler {

    private final EnergyRecordRepository repository;

    @Transactional(readOnly = true)
    public List<EnergyRecordResponse> handle(GetSiteAnomaliesQuery query) {
        log.debug("Handling GetSiteAnomaliesQuery: {}", query);

        List<EnergyRecordResponse> anomalies = repository.findAnomaliesBySite(query.getSiteId())
                .stream()
                .map(EnergyRecordResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} anomalies for siteId={}", anomalies.size(), query.getSiteId());

        return anomalies;
    }
}
