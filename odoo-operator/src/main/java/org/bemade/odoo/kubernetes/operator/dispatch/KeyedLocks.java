/*
 * Copyright Odoo Operator Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package org.bemade.odoo.kubernetes.operator.dispatch;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.bemade.odoo.tag.VisibleForTesting;

/**
 * A mutex per key. Work for the same key runs one caller at a time, work for different keys runs
 * concurrently. Locks are discarded once no caller holds or waits for them.
 */
public class KeyedLocks {

    private final Map<String, Entry> locks = new ConcurrentHashMap<>();

    private static final class Entry {
        private final ReentrantLock lock = new ReentrantLock();
        private int users;
    }

    public <T> T withLock(String key, Supplier<T> work) {
        Entry entry = locks.compute(key, (k, existing) -> {
            Entry e = existing == null ? new Entry() : existing;
            e.users++;
            return e;
        });
        entry.lock.lock();
        try {
            return work.get();
        }
        finally {
            entry.lock.unlock();
            locks.computeIfPresent(key, (k, e) -> --e.users == 0 ? null : e);
        }
    }

    public void runWithLock(String key, Runnable work) {
        withLock(key, () -> {
            work.run();
            return null;
        });
    }

    @VisibleForTesting
    int size() {
        return locks.size();
    }
}
