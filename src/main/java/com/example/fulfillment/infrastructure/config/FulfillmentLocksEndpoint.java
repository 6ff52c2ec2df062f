package com.example.fulfillment.infrastructure.config;

import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import org.springframework.boot.actuate.endpoint.annotation.Endpoint;
import org.springframework.boot.actuate.endpoint.annotation.ReadOperation;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Actuator endpoint reporting in-flight order work, useful while draining.
 */
@Component
@Endpoint(id = "fulfillmentlocks")
public class FulfillmentLocksEndpoint {

    private final GracefulShutdownConfig gracefulShutdownConfig;
    private final OrderLockRegistry lockRegistry;

    public FulfillmentLocksEndpoint(GracefulShutdownConfig gracefulShutdownConfig, OrderLockRegistry lockRegistry) {
        this.gracefulShutdownConfig = gracefulShutdownConfig;
        this.lockRegistry = lockRegistry;
    }

    @ReadOperation
    public Map<String, Object> fulfillmentLocks() {
        int holders = lockRegistry.getActiveHolders();
        int requests = gracefulShutdownConfig.getActiveRequestCount();
        return Map.of(
                "activeRequests", requests,
                "lockHolders", holders,
                "lockStripes", lockRegistry.getStripeCount(),
                "draining", gracefulShutdownConfig.isDraining(),
                "status", holders + requests > 0 ? "BUSY" : "IDLE"
        );
    }
}
