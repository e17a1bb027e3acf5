package com.hedgedata.data.cache;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One lock per logical key (record kind x ticker). A second request for a key
 * waits for the in-flight one and then reads what it cached.
 */
final class KeyedLocks {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    ReentrantLock lockFor(String kind, String ticker) {
        return locks.computeIfAbsent(kind + "|" + ticker, k -> new ReentrantLock());
    }

    int size() {
        return locks.size();
    }
}
