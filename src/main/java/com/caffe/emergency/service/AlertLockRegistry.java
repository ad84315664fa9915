package com.caffe.emergency.service;

import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Striped locks serializing transitions of the same alert id. Distinct ids may share
 * a stripe, which only costs throughput.
 */
class AlertLockRegistry {

    private final ReentrantLock[] stripes;

    AlertLockRegistry(int stripeCount) {
        stripes = new ReentrantLock[Math.max(1, stripeCount)];
        for (int i = 0; i < stripes.length; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    <T> T withLock(String alertId, Supplier<T> transition) {
        ReentrantLock lock = stripes[(alertId.hashCode() & 0x7fffffff) % stripes.length];
        lock.lock();
        try {
            return transition.get();
        } finally {
            lock.unlock();
        }
    }
}
