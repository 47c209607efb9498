package com.koni.energy.application.query;

import com.koni.energy.domain.exception.ValidationException;
import com.koni.energy.domain.repository.EnergyRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Query handler for the records of one site.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class GetSiteRecordsQueryHandler {

    private final EnergyRecordRepository repository;

    /**
     * Returns the site's records in ascending timestamp order, restricted to [start, end)
     * when bounds are given. An unknown site yields an empty list.
     *
     * @param query the site and optional bounds
     * @return the matching records
     * @throws ValidationException if start is after end
     */
    @Transactional(readOnly = true)
    public List<EnergyRecordResponse> handle(GetSiteRecordsQuery query) {
        log.debug("Handling GetSiteRecordsQuery: {}", query);

        if (query.getStart() != null && query.getEnd() != null && query.getStart().isAfter(query.getEnd())) {
            throw new ValidationException("start must not be after end");
        }

        List<EnergyRecordResponse> records = repository.findBySite(query.getSiteId(), query.getStart(), query.getEnd())
                .stream()
                .map(EnergyRecordResponse::from)
                .collect(Collectors.toList());

        log.info("Retrieved {} records for siteId={}", records.size(), query.getSiteId());

        return records;
    }
}
