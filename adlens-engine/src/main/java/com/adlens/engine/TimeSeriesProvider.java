package com.adlens.engine;

/**
 * Supplies a metric's values over time, optionally filtered to one campaign. Implementations preserve
 * chronological order and report absence of data through {@link SeriesResult#failure} instead of throwing.
 */
public interface TimeSeriesProvider {

    /**
     * @param scope  campaign identifier, or an all-campaigns scope (see {@link com.adlens.model.Task#isAllScope})
     * @param metric metric column, e.g. {@code ctr}
     */
    SeriesResult getSeries(String scope, String metric);
}
