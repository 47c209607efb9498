package com.koni.energy.application.query;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Query for the anomalous records of one site.
 */
@Getter
@ToString
@AllArgsConstructor
public class GetSiteAnomaliesQuery {

    private final String siteId;
}
