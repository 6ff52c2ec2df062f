package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.ApplicationListener;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Drains in-flight work on shutdown: background loops stop taking new
 * orders, then the context waits for HTTP requests and order-lock holders
 * to finish their current order rather than cutting them off mid-transaction.
 */
@Component
public class GracefulShutdownConfig implements ApplicationListener<ContextClosedEvent> {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownConfig.class);

    private final AtomicInteger activeRequests = new AtomicInteger(0);
    private final OrderLockRegistry lockRegistry;
    private final int maxWaitSeconds;

    public GracefulShutdownConfig(
            OrderLockRegistry lockRegistry,
            @Value("${fulfillment.shutdown.max-wait-seconds:25}") int maxWaitSeconds) {
        this.lockRegistry = lockRegistry;
        this.maxWaitSeconds = maxWaitSeconds;
    }

    public void incrementActiveRequests() {
        int count = activeRequests.incrementAndGet();
        log.debug("Request started. Active requests: {}", count);
    }

    public void decrementActiveRequests() {
        int count = activeRequests.decrementAndGet();
        log.debug("Request completed. Active requests: {}", count);
    }

    public int getActiveRequestCount() {
        return activeRequests.get();
    }

    public boolean isDraining() {
        return lockRegistry.isShuttingDown();
    }

    @Override
    public void onApplicationEvent(ContextClosedEvent event) {
        lockRegistry.beginShutdown();
        log.info("Shutdown signal received. Active requests: {}, order lock holders: {}",
                activeRequests.get(), lockRegistry.getActiveHolders());

        int waitSeconds = maxWaitSeconds;
        while (inFlight() > 0 && waitSeconds > 0) {
            log.info("Waiting for {} request(s) and {} order lock holder(s)... ({} seconds remaining)",
                    activeRequests.get(), lockRegistry.getActiveHolders(), waitSeconds);
            try {
                Thread.sleep(1000);
                waitSeconds--;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Shutdown interrupted while draining in-flight work");
                break;
            }
        }

        if (inFlight() > 0) {
            log.warn("Graceful shutdown timeout. {} request(s) and {} order lock holder(s) may be interrupted.",
                    activeRequests.get(), lockRegistry.getActiveHolders());
        } else {
            log.info("Graceful shutdown complete. No order work in flight.");
        }
    }

    private int inFlight() {
        return activeRequests.get() + lockRegistry.getActiveHolders();
    }
}
