package com.hedgedata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * An insider transaction as reported in a filing.
 * transactionDate may be absent, in which case the filing date orders the trade.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InsiderTrade(
    String ticker,
    String filingDate,
    String transactionDate,      // nullable
    String insiderName,
    String title,
    String transactionType,      // e.g. "P", "S" or provider-specific wording
    Double shares,
    Double price,
    Double value,
    Double sharesOwnedAfter
) implements FinancialRecord {

    @JsonIgnore
    @Override
    public String dateKey() {
        return transactionDate != null && !transactionDate.isBlank() ? transactionDate : filingDate;
    }

    @JsonIgnore
    @Override
    public String dedupKey() {
        return ticker + "|" + filingDate + "|" + transactionDate + "|" + insiderName
            + "|" + transactionType + "|" + shares;
    }

    @JsonIgnore
    public boolean isSale() {
        return shares != null && shares < 0;
    }
}
