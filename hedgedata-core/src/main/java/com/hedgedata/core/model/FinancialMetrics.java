package com.hedgedata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * Financial ratios for one reporting period of a ticker.
 * Absent metrics are simply missing from {@link #values()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record FinancialMetrics(
    String ticker,
    String reportPeriod,     // period end date, yyyy-MM-dd
    String period,           // "ttm", "annual" or "quarterly"
    String currency,         // may be null
    Map<FinancialMetric, Double> values
) implements FinancialRecord {

    public FinancialMetrics {
        EnumMap<FinancialMetric, Double> copy = new EnumMap<>(FinancialMetric.class);
        if (values != null) {
            values.forEach((metric, value) -> {
                if (metric != null && value != null && !value.isNaN()) {
                    copy.put(metric, value);
                }
            });
        }
        values = Collections.unmodifiableMap(copy);
    }

    @JsonIgnore
    @Override
    public String dateKey() {
        return reportPeriod;
    }

    @JsonIgnore
    @Override
    public String dedupKey() {
        return ticker + "|" + reportPeriod + "|" + period;
    }

    /**
     * Value of a metric, if the provider reported it.
     */
    public Optional<Double> get(FinancialMetric metric) {
        return Optional.ofNullable(values.get(metric));
    }

    @JsonIgnore
    public Optional<Double> marketCap() {
        return get(FinancialMetric.MARKET_CAP);
    }
}
