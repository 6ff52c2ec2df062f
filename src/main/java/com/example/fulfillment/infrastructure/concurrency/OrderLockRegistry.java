package com.example.fulfillment.infrastructure.concurrency;

import com.example.fulfillment.domain.model.OrderId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Process-local serialization of work per order, backed by a fixed pool of
 * locks striped by {@code hash(orderId) mod N}. Two orders may share a
 * stripe; that costs throughput, never correctness.
 * <p>
 * Any read-decide-act sequence that ends in a charge or a shipment creation
 * holds the order's lock for its whole duration. The lock only removes
 * redundant external calls: correctness comes from the status
 * compare-and-set. Running several instances requires a distributed lock
 * or a locking read in its place.
 */
@Component
public class OrderLockRegistry {

    private static final Logger log = LoggerFactory.getLogger(OrderLockRegistry.class);

    private final ReentrantLock[] stripes;
    private final AtomicInteger activeHolders = new AtomicInteger(0);
    private volatile boolean shuttingDown;

    public OrderLockRegistry(@Value("${fulfillment.lock.stripes:64}") int stripeCount) {
        if (stripeCount < 1) {
            throw new IllegalArgumentException("Lock stripe count must be positive: " + stripeCount);
        }
        this.stripes = new ReentrantLock[stripeCount];
        for (int i = 0; i < stripeCount; i++) {
            stripes[i] = new ReentrantLock();
        }
    }

    /**
     * Runs the action while holding the order's lock.
     */
    public <T> T withLock(OrderId orderId, Supplier<T> action) {
        ReentrantLock lock = stripes[stripeIndex(orderId)];
        lock.lock();
        int holders = activeHolders.incrementAndGet();
        log.trace("Lock acquired for order {} (active holders: {})", orderId, holders);
        try {
            return action.get();
        } finally {
            activeHolders.decrementAndGet();
            lock.unlock();
        }
    }

    public void withLock(OrderId orderId, Runnable action) {
        withLock(orderId, () -> {
            action.run();
            return null;
        });
    }

    int stripeIndex(OrderId orderId) {
        return Math.floorMod(orderId.hashCode(), stripes.length);
    }

    public int getStripeCount() {
        return stripes.length;
    }

    /**
     * Number of threads currently inside {@link #withLock}.
     */
    public int getActiveHolders() {
        return activeHolders.get();
    }

    /**
     * Tells background loops to stop picking up new orders.
     */
    public void beginShutdown() {
        shuttingDown = true;
    }

    public boolean isShuttingDown() {
        return shuttingDown;
    }
}
