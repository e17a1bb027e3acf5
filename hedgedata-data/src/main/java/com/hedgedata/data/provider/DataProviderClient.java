package com.hedgedata.data.provider;

import com.hedgedata.core.model.CompanyNews;
import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.model.FinancialMetrics;
import com.hedgedata.core.model.InsiderTrade;
import com.hedgedata.core.model.LineItem;
import com.hedgedata.core.model.Price;
import com.hedgedata.data.exception.FetchException;

import java.util.List;
import java.util.Optional;

/**
 * Access to one external financial data provider.
 *
 * Implementations read through the shared record cache and only call the
 * provider for data the cache cannot answer. They neither retry nor fail
 * over; a failed call surfaces as {@link FetchException}.
 *
 * Dates are inclusive ISO dates (yyyy-MM-dd); the other accepted forms of
 * {@link com.hedgedata.core.util.DateFormats#normalize(String)} are normalized.
 */
public interface DataProviderClient {

    DataProvider getProvider();

    /**
     * Daily bars with {@code startDate <= time <= endDate}, oldest first.
     */
    List<Price> getPrices(String ticker, String startDate, String endDate) throws FetchException;

    /**
     * Metrics of the given period type ("ttm", "annual", "quarterly") reported
     * on or before {@code endDate}, newest first, at most {@code limit}.
     */
    List<FinancialMetrics> getFinancialMetrics(String ticker, String endDate, String period, int limit)
        throws FetchException;

    /**
     * Requested statement line items, newest report period first, covering at
     * most {@code limit} report periods. Names the provider cannot map are skipped.
     */
    List<LineItem> searchLineItems(String ticker, List<String> lineItems, String endDate, String period, int limit)
        throws FetchException;

    /**
     * Insider trades dated within [startDate, endDate], newest first.
     *
     * @param startDate null for no lower bound
     */
    List<InsiderTrade> getInsiderTrades(String ticker, String endDate, String startDate, int limit)
        throws FetchException;

    /**
     * News dated within [startDate, endDate], newest first.
     *
     * @param startDate null for no lower bound
     */
    List<CompanyNews> getCompanyNews(String ticker, String endDate, String startDate, int limit)
        throws FetchException;

    /**
     * Market capitalization as of {@code endDate}. Never cached.
     */
    Optional<Double> getMarketCap(String ticker, String endDate) throws FetchException;
}
