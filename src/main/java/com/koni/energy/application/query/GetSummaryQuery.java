package com.koni.energy.application.query;

/**
 * Query for the aggregate summary over all stored records.
 * Carries no parameters.
 */
public class GetSummaryQuery {
}
