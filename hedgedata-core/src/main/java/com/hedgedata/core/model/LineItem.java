package com.hedgedata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One named financial-statement value (e.g. "net_income") for a reporting period.
 * Several line items share a report period; the name tells them apart.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record LineItem(
    String ticker,
    String lineItem,         // canonical snake_case name
    Double value,            // null when the statement lists the item without a value
    String reportPeriod,
    String period,
    String currency
) implements FinancialRecord {

    @JsonIgnore
    @Override
    public String dateKey() {
        return reportPeriod;
    }

    @JsonIgnore
    @Override
    public String dedupKey() {
        return ticker + "|" + reportPeriod + "|" + period + "|" + lineItem;
    }
}
