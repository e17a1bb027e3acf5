package com.hedgedata.runner;

import com.hedgedata.core.model.DataProvider;
import com.hedgedata.core.util.DateFormats;
import com.hedgedata.data.ProviderSettings;
import com.hedgedata.data.compare.ComparisonReport;
import com.hedgedata.data.compare.ProviderComparison;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Provider Compare - prints how two data providers disagree on the same tickers.
 *
 * Usage: ProviderCompareApp [--tickers AAPL,MSFT] [--days 30] [--left finnhub] [--right financial_datasets]
 */
public class ProviderCompareApp {
    private static final Logger LOG = LoggerFactory.getLogger(ProviderCompareApp.class);

    static final List<String> DEFAULT_TICKERS = List.of("AAPL", "MSFT", "GOOGL");
    static final int DEFAULT_DAYS = 30;

    record Options(List<String> tickers, int days, DataProvider left, DataProvider right) {
    }

    public static void main(String[] args) {
        Options options;
        try {
            options = parse(args);
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            System.err.println("Usage: ProviderCompareApp [--tickers AAPL,MSFT] [--days 30] "
                + "[--left finnhub] [--right financial_datasets]");
            System.exit(2);
            return;
        }

        LocalDate end = LocalDate.now(ZoneOffset.UTC);
        String endDate = DateFormats.format(end);
        String startDate = DateFormats.format(end.minusDays(options.days()));
        LOG.info("Comparing {} and {} for {} from {} to {}", options.left().getDisplayName(),
            options.right().getDisplayName(), options.tickers(), startDate, endDate);

        ProviderComparison comparison = new ProviderComparison(ProviderSettings.load());
        int flagged = 0;
        for (String ticker : options.tickers()) {
            ComparisonReport report = comparison.compare(ticker, startDate, endDate, options.left(), options.right());
            System.out.println(report.format());
            flagged += report.significantDifferences().size();
        }
        System.out.println(flagged + " field(s) differ by more than 0.01%");
    }

    static Options parse(String[] args) {
        List<String> tickers = DEFAULT_TICKERS;
        int days = DEFAULT_DAYS;
        DataProvider left = DataProvider.FINNHUB;
        DataProvider right = DataProvider.FINANCIAL_DATASETS;

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (i + 1 >= args.length) {
                throw new IllegalArgumentException("Missing value for " + arg);
            }
            String value = args[++i];
            switch (arg) {
                case "--tickers" -> tickers = parseTickers(value);
                case "--days" -> days = parseDays(value);
                case "--left" -> left = parseProvider(value);
                case "--right" -> right = parseProvider(value);
                default -> throw new IllegalArgumentException("Unknown option: " + arg);
            }
        }
        if (left == right) {
            throw new IllegalArgumentException("--left and --right must name different providers");
        }
        return new Options(tickers, days, left, right);
    }

    private static List<String> parseTickers(String value) {
        List<String> tickers = new ArrayList<>();
        Arrays.stream(value.split(","))
            .map(String::trim)
            .filter(s -> !s.isEmpty())
            .map(String::toUpperCase)
            .forEach(tickers::add);
        if (tickers.isEmpty()) {
            throw new IllegalArgumentException("No tickers given");
        }
        return List.copyOf(tickers);
    }

    private static int parseDays(String value) {
        try {
            int days = Integer.parseInt(value.trim());
            if (days <= 0) {
                throw new IllegalArgumentException("--days must be positive");
            }
            return days;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--days must be a number: " + value);
        }
    }

    private static DataProvider parseProvider(String value) {
        DataProvider provider = DataProvider.fromConfigKey(value);
        if (provider == null) {
            throw new IllegalArgumentException("Unsupported data provider: " + value);
        }
        return provider;
    }
}
