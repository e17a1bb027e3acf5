package com.hedgedata.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FinancialMetricsTest {

    @Test
    @DisplayName("Missing and NaN values are dropped")
    void dropsMissingValues() {
        Map<FinancialMetric, Double> values = new HashMap<>();
        values.put(FinancialMetric.MARKET_CAP, 3.0e12);
        values.put(FinancialMetric.PEG_RATIO, Double.NaN);
        values.put(FinancialMetric.NET_MARGIN, null);

        FinancialMetrics metrics = new FinancialMetrics("AAPL", "2023-09-30", "ttm", "USD", values);

        assertEquals(1, metrics.values().size());
        assertEquals(3.0e12, metrics.marketCap().orElseThrow());
        assertTrue(metrics.get(FinancialMetric.PEG_RATIO).isEmpty());
        assertThrows(UnsupportedOperationException.class,
            () -> metrics.values().put(FinancialMetric.PEG_RATIO, 1.0));
    }

    @Test
    @DisplayName("JSON form holds the fields but not the derived keys")
    void jsonHasNoDerivedKeys() throws Exception {
        ObjectMapper mapper = new ObjectMapper();
        FinancialMetrics metrics = new FinancialMetrics("AAPL", "2023-09-30", "ttm", null,
            Map.of(FinancialMetric.CURRENT_RATIO, 0.99));

        JsonNode json = mapper.readTree(mapper.writeValueAsString(metrics));

        assertEquals("2023-09-30", json.get("reportPeriod").asText());
        assertFalse(json.has("dateKey"));
        assertFalse(json.has("dedupKey"));
        assertEquals(metrics, mapper.treeToValue(json, FinancialMetrics.class));
    }

    @Test
    @DisplayName("Canonical names resolve back to metrics")
    void canonicalNames() {
        assertEquals(FinancialMetric.RETURN_ON_EQUITY, FinancialMetric.fromCanonicalName("return_on_equity"));
        assertNull(FinancialMetric.fromCanonicalName("roeTTM"));
    }
}
