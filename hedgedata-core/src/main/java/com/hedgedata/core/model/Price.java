package com.hedgedata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Daily OHLCV bar for a ticker. One row per trading day.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Price(
    String ticker,
    String time,     // trading day, yyyy-MM-dd
    double open,
    double high,
    double low,
    double close,
    long volume
) implements FinancialRecord {

    @JsonIgnore
    @Override
    public String dateKey() {
        return time;
    }

    @JsonIgnore
    @Override
    public String dedupKey() {
        return ticker + "|" + time;
    }

    /**
     * Day range as a fraction of the close (0 when close is not positive).
     */
    @JsonIgnore
    public double rangePercent() {
        return close > 0 ? (high - low) / close : 0.0;
    }
}
