package com.koni.energy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * Query for the records of one site, optionally bounded by the half-open range [start, end).
 */
@Getter
@ToString
@AllArgsConstructor
public class GetSiteRecordsQuery {

    private final String siteId;

    /**
     * Inclusive lower bound, null for unbounded.
     */
    private final Instant start;

    /**
     * Exclusive upper bound, null for unbounded.
     */
    private final Instant end;
}
