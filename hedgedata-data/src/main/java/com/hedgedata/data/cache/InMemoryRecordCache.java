package com.hedgedata.data.cache;

import com.hedgedata.core.model.FinancialRecord;
import com.hedgedata.core.model.RecordKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.Lock;

/**
 * Process-local record cache. Merges run inside {@link ConcurrentHashMap#compute}
 * so writes to the same (kind, ticker) never interleave.
 *
 * Subclasses can back the map with durable storage through
 * {@link #loadExisting} and {@link #persist}.
 */
public class InMemoryRecordCache implements RecordCache {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRecordCache.class);

    private final Map<CacheKey, List<? extends FinancialRecord>> entries = new ConcurrentHashMap<>();
    private final KeyedLocks locks = new KeyedLocks();

    @Override
    public <T extends FinancialRecord> List<T> get(RecordKind<T> kind, String ticker) {
        CacheKey key = new CacheKey(kind.getKey(), normalizeTicker(ticker));
        List<? extends FinancialRecord> cached = entries.computeIfAbsent(key, k -> {
            List<T> loaded = loadExisting(kind, k.ticker());
            return loaded.isEmpty() ? null : List.copyOf(loaded);
        });
        return cached == null ? List.of() : cast(kind, cached);
    }

    @Override
    public <T extends FinancialRecord> void set(RecordKind<T> kind, String ticker, List<T> records) {
        if (records == null || records.isEmpty()) {
            return;
        }
        String normalized = normalizeTicker(ticker);
        CacheKey key = new CacheKey(kind.getKey(), normalized);
        entries.compute(key, (k, existing) -> {
            List<T> current = existing != null ? cast(kind, existing) : loadExisting(kind, normalized);
            List<T> merged = merge(kind, current, records);
            persist(kind, normalized, merged);
            log.debug("Cached {} {} for {} ({} incoming)", merged.size(), kind, normalized, records.size());
            return merged;
        });
    }

    @Override
    public Lock lockFor(RecordKind<?> kind, String ticker) {
        return locks.lockFor(kind.getKey(), normalizeTicker(ticker));
    }

    @Override
    public void clear() {
        entries.clear();
    }

    @Override
    public void clear(String ticker) {
        String normalized = normalizeTicker(ticker);
        entries.keySet().removeIf(k -> k.ticker().equals(normalized));
    }

    /**
     * Records already stored for a (kind, ticker) not yet held in memory.
     */
    protected <T extends FinancialRecord> List<T> loadExisting(RecordKind<T> kind, String ticker) {
        return List.of();
    }

    /**
     * Called with the merged collection after every write, while the key is locked.
     */
    protected <T extends FinancialRecord> void persist(RecordKind<T> kind, String ticker, List<T> records) {
    }

    static <T extends FinancialRecord> List<T> merge(RecordKind<T> kind, List<T> existing, List<T> incoming) {
        Map<String, T> byKey = new LinkedHashMap<>();
        for (T record : existing) {
            byKey.put(record.dedupKey(), record);
        }
        for (T record : incoming) {
            byKey.put(record.dedupKey(), record);
        }
        List<T> merged = new ArrayList<>(byKey.values());
        merged.sort(kind.getOrder());
        return List.copyOf(merged);
    }

    static String normalizeTicker(String ticker) {
        if (ticker == null || ticker.isBlank()) {
            throw new IllegalArgumentException("Ticker is required");
        }
        return ticker.trim().toUpperCase();
    }

    // Entries are only ever written under a key whose kind matches
    @SuppressWarnings("unchecked")
    private static <T extends FinancialRecord> List<T> cast(RecordKind<T> kind, List<? extends FinancialRecord> list) {
        return (List<T>) list;
    }

    private record CacheKey(String kind, String ticker) {
    }
}
