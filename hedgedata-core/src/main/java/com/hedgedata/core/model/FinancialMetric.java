package com.hedgedata.core.model;

/**
 * Canonical names of the numeric ratios carried by {@link FinancialMetrics}.
 * Providers translate their own field names into these.
 */
public enum FinancialMetric {
    MARKET_CAP("market_cap"),
    ENTERPRISE_VALUE("enterprise_value"),
    PRICE_TO_EARNINGS_RATIO("price_to_earnings_ratio"),
    PRICE_TO_BOOK_RATIO("price_to_book_ratio"),
    PRICE_TO_SALES_RATIO("price_to_sales_ratio"),
    ENTERPRISE_VALUE_TO_EBITDA_RATIO("enterprise_value_to_ebitda_ratio"),
    ENTERPRISE_VALUE_TO_REVENUE_RATIO("enterprise_value_to_revenue_ratio"),
    FREE_CASH_FLOW_YIELD("free_cash_flow_yield"),
    PEG_RATIO("peg_ratio"),
    GROSS_MARGIN("gross_margin"),
    OPERATING_MARGIN("operating_margin"),
    NET_MARGIN("net_margin"),
    RETURN_ON_EQUITY("return_on_equity"),
    RETURN_ON_ASSETS("return_on_assets"),
    RETURN_ON_INVESTED_CAPITAL("return_on_invested_capital"),
    CURRENT_RATIO("current_ratio"),
    QUICK_RATIO("quick_ratio"),
    DEBT_TO_EQUITY("debt_to_equity"),
    INTEREST_COVERAGE("interest_coverage"),
    DIVIDEND_YIELD("dividend_yield"),
    PAYOUT_RATIO("payout_ratio"),
    REVENUE_GROWTH("revenue_growth"),
    EARNINGS_GROWTH("earnings_growth"),
    EARNINGS_PER_SHARE("earnings_per_share"),
    BOOK_VALUE_PER_SHARE("book_value_per_share"),
    FREE_CASH_FLOW_PER_SHARE("free_cash_flow_per_share");

    private final String canonicalName;

    FinancialMetric(String canonicalName) {
        this.canonicalName = canonicalName;
    }

    public String getCanonicalName() {
        return canonicalName;
    }

    /**
     * Look up a metric by its canonical snake_case name.
     *
     * @return the metric, or null if the name is not canonical
     */
    public static FinancialMetric fromCanonicalName(String name) {
        if (name == null) return null;
        for (FinancialMetric m : values()) {
            if (m.canonicalName.equals(name)) {
                return m;
            }
        }
        return null;
    }
}
