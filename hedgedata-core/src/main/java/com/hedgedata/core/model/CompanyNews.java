package com.hedgedata.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * A news article about a company. Many articles may share a date.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompanyNews(
    String ticker,
    String date,
    String headline,
    String summary,
    String source,
    String url,
    String sentiment     // nullable, only some providers score articles
) implements FinancialRecord {

    @JsonIgnore
    @Override
    public String dateKey() {
        return date;
    }

    // Articles are identified by URL; fall back to the headline when a provider omits it
    @JsonIgnore
    @Override
    public String dedupKey() {
        String id = url != null && !url.isBlank() ? url : headline;
        return ticker + "|" + date + "|" + id;
    }
}
