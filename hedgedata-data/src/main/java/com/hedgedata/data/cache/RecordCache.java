package com.hedgedata.data.cache;

import com.hedgedata.core.model.FinancialRecord;
import com.hedgedata.core.model.RecordKind;

import java.util.List;
import java.util.concurrent.locks.Lock;

/**
 * Per-ticker store of fetched records, one ordered collection per record kind.
 *
 * Reads return the whole cached collection unfiltered (empty when nothing is
 * cached). Writes merge: an incoming record replaces a cached one with the same
 * {@link FinancialRecord#dedupKey()}, new keys are added, and the collection is
 * re-sorted in the kind's order. There is no expiry.
 */
public interface RecordCache {

    <T extends FinancialRecord> List<T> get(RecordKind<T> kind, String ticker);

    <T extends FinancialRecord> void set(RecordKind<T> kind, String ticker, List<T> records);

    /**
     * Lock guarding one (kind, ticker) collection. Every client sharing this
     * cache gets the same lock for the same key, so a fetch-and-merge for a key
     * runs once at a time whichever provider performs it.
     */
    Lock lockFor(RecordKind<?> kind, String ticker);

    /**
     * Drop every cached collection.
     */
    void clear();

    /**
     * Drop every cached collection of one ticker.
     */
    void clear(String ticker);
}
