package com.koni.energy.infrastructure.web.controller;

import com.koni.energy.application.query.EnergyRecordResponse;
import com.koni.energy.application.query.GetSiteAnomaliesQuery;
import com.koni.energy.application.query.GetSiteAnomaliesQueryHandler;
import com.koni.energy.application.query.GetSiteRecordsQuery;
import com.koni.energy.application.query.GetSiteRecordsQueryHandler;
import com.koni.energy.application.query.GetSummaryQuery;
import com.koni.energy.application.query.GetSummaryQueryHandler;
import com.koni.energy.application.query.SummaryResponse;
import com.koni.energy.domain.model.Timestamps;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST controller for the read-only query surface.
 *
 * Endpoints:
 * - GET /summary: totals over every stored record
 * - GET /records/{site_id}?start=&end=: records of one site within [start, end)
 * - GET /anomalies/{site_id}: anomalous records of one site
 *
 * Records are returned in ascending timestamp order; an unknown site yields an empty list.
 */
@RestController
@RequiredArgsConstructor
@Slf4j
public class EnergyQueryController {

    private final GetSummaryQueryHandler summaryQueryHandler;
    private final GetSiteRecordsQueryHandler siteRecordsQueryHandler;
    private final GetSiteAnomaliesQueryHandler siteAnomaliesQueryHandler;

    @GetMapping("/summary")
    public ResponseEntity<SummaryResponse> getSummary() {
        log.info("Received request for system summary");
        return ResponseEntity.ok(summaryQueryHandler.handle(new GetSummaryQuery()));
    }

    /**
     * Example request:
     * GET /records/alpha?start=2024-01-01T00:00:00Z&end=2024-01-02T00:00:00Z
     *
     * @param siteId the site identifier
     * @param start optional inclusive lower bound, ISO-8601 with offset
     * @param end optional exclusive upper bound, ISO-8601 with offset
     * @return 200 OK with the matching records, 400 if a bound is malformed or start is after end
     */
    @GetMapping("/records/{site_id}")
    public ResponseEntity<List<EnergyRecordResponse>> getSiteRecords(
            @PathVariable("site_id") String siteId,
            @RequestParam(name = "start", required = false) String start,
            @RequestParam(name = "end", required = false) String end) {
        log.info("Received request for site records: siteId={}, start={}, end={}", siteId, start, end);

        GetSiteRecordsQuery query = new GetSiteRecordsQuery(siteId, parseBound(start, "start"), parseBound(end, "end"));

        return ResponseEntity.ok(siteRecordsQueryHandler.handle(query));
    }

    @GetMapping("/anomalies/{site_id}")
    public ResponseEntity<List<EnergyRecordResponse>> getSiteAnomalies(@PathVariable("site_id") String siteId) {
        log.info("Received request for site anomalies: siteId={}", siteId);
        return ResponseEntity.ok(siteAnomaliesQueryHandler.handle(new GetSiteAnomaliesQuery(siteId)));
    }

    private static Instant parseBound(String value, String name) {
        return value == null ? null : Timestamps.parse(value, name);
    }
}
