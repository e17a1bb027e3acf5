package com.hedgedata.core.model;

/**
 * A single fetched fact about a ticker, keyed by a calendar date.
 *
 * Implementations are immutable. Two records with the same {@link #dedupKey()}
 * describe the same fact; caches keep only the most recently written one.
 */
public interface FinancialRecord {

    /**
     * Ticker symbol this record belongs to (e.g. "AAPL", "D05.SI").
     */
    String ticker();

    /**
     * Temporal key as an ISO date (yyyy-MM-dd), used for range reads and ordering.
     */
    String dateKey();

    /**
     * Identity of the fact for merge purposes: ticker + temporal key + any
     * kind-specific discriminator.
     */
    String dedupKey();
}
