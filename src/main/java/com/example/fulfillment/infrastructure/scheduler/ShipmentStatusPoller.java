package com.example.fulfillment.infrastructure.scheduler;

import com.example.fulfillment.application.service.ShipmentTrackingService;
import com.example.fulfillment.application.service.ShipmentTrackingService.PollReport;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Fixed-delay trigger for carrier status polling.
 */
@Component
@ConditionalOnProperty(value = "fulfillment.poller.enabled", havingValue = "true", matchIfMissing = true)
public class ShipmentStatusPoller {

    private static final Logger log = LoggerFactory.getLogger(ShipmentStatusPoller.class);

    private final ShipmentTrackingService trackingService;
    private final OrderLockRegistry lockRegistry;
    private final int batchSize;

    public ShipmentStatusPoller(
            ShipmentTrackingService trackingService,
            OrderLockRegistry lockRegistry,
            @Value("${fulfillment.poller.batch-size:100}") int batchSize) {
        this.trackingService = trackingService;
        this.lockRegistry = lockRegistry;
        this.batchSize = batchSize;
    }

    @Scheduled(fixedDelayString = "${fulfillment.poller.interval-ms:300000}",
               initialDelayString = "${fulfillment.poller.interval-ms:300000}")
    public void poll() {
        if (lockRegistry.isShuttingDown()) {
            return;
        }
        try {
            PollReport report = trackingService.pollShipments(batchSize);
            if (report.polled() + report.failures() > 0) {
                log.info("[POLL] polled={}, tracking={}, statusChanges={}, failures={}",
                        report.polled(), report.trackingAssigned(), report.statusChanges(), report.failures());
            }
        } catch (RuntimeException e) {
            log.error("[POLL] pass failed", e);
        }
    }
}
