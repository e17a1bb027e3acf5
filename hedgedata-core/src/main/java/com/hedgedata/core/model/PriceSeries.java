package com.hedgedata.core.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chronological, one-bar-per-day view over a list of prices.
 * Later duplicates of a day replace earlier ones.
 */
public final class PriceSeries {

    private final List<Price> prices;

    private PriceSeries(List<Price> prices) {
        this.prices = prices;
    }

    public static PriceSeries of(Collection<Price> prices) {
        Map<String, Price> byDay = new LinkedHashMap<>();
        for (Price p : prices) {
            byDay.put(p.time(), p);
        }
        List<Price> sorted = new ArrayList<>(byDay.values());
        sorted.sort(Comparator.comparing(Price::time));
        return new PriceSeries(List.copyOf(sorted));
    }

    public List<Price> prices() {
        return prices;
    }

    public int size() {
        return prices.size();
    }

    public boolean isEmpty() {
        return prices.isEmpty();
    }

    public Optional<Price> first() {
        return prices.isEmpty() ? Optional.empty() : Optional.of(prices.get(0));
    }

    public Optional<Price> last() {
        return prices.isEmpty() ? Optional.empty() : Optional.of(prices.get(prices.size() - 1));
    }

    public double[] closes() {
        double[] out = new double[prices.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = prices.get(i).close();
        }
        return out;
    }

    /**
     * Close-to-close return over the whole series, or 0 with fewer than two bars.
     */
    public double totalReturn() {
        if (prices.size() < 2) return 0.0;
        double start = prices.get(0).close();
        double end = prices.get(prices.size() - 1).close();
        return start > 0 ? (end - start) / start : 0.0;
    }
}
