package com.caffe.emergency.service;

import com.caffe.emergency.model.NotificationChannel;
import com.caffe.emergency.model.Recipient;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cumulative delivery counters since process start.
 */
@Component
public class DeliveryStatistics {

    private final AtomicLong attempts = new AtomicLong();
    private final AtomicLong delivered = new AtomicLong();
    private final Set<String> reachedRecipients = ConcurrentHashMap.newKeySet();

    public void recordAttempt(NotificationChannel channel, Recipient recipient, boolean success) {
        attempts.incrementAndGet();
        if (success) {
            delivered.incrementAndGet();
            reachedRecipients.add(recipient.getId() != null ? recipient.getId() : channel.getValue() + ":" + recipient.getName());
        }
    }

    public long getAttempts() {
        return attempts.get();
    }

    public long getDelivered() {
        return delivered.get();
    }

    public long getReachedRecipients() {
        return reachedRecipients.size();
    }

    /**
     * Percentage of attempts that succeeded, 0 when nothing was attempted.
     */
    public double getSuccessRate() {
        long total = attempts.get();
        if (total == 0) {
            return 0;
        }
        return Math.round(delivered.get() * 1000.0 / total) / 10.0;
    }
}
