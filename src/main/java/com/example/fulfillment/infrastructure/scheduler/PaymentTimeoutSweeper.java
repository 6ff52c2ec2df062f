package com.example.fulfillment.infrastructure.scheduler;

import com.example.fulfillment.application.service.PaymentReconciliationService;
import com.example.fulfillment.application.service.PaymentReconciliationService.SweepReport;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Fixed-delay trigger for payment timeout reconciliation.
 */
@Component
@ConditionalOnProperty(value = "fulfillment.sweeper.enabled", havingValue = "true", matchIfMissing = true)
public class PaymentTimeoutSweeper {

    private static final Logger log = LoggerFactory.getLogger(PaymentTimeoutSweeper.class);

    private final PaymentReconciliationService reconciliationService;
    private final OrderLockRegistry lockRegistry;

    public PaymentTimeoutSweeper(PaymentReconciliationService reconciliationService, OrderLockRegistry lockRegistry) {
        this.reconciliationService = reconciliationService;
        this.lockRegistry = lockRegistry;
    }

    @Scheduled(fixedDelayString = "${fulfillment.sweeper.interval-ms:60000}",
               initialDelayString = "${fulfillment.sweeper.interval-ms:60000}")
    public void sweep() {
        if (lockRegistry.isShuttingDown()) {
            return;
        }
        try {
            SweepReport report = reconciliationService.sweepExpired(Instant.now());
            if (!report.isEmpty()) {
                log.info("[SWEEP] settled={}, abandoned={}, expired={}, deferred={}",
                        report.settled(), report.abandoned(), report.expired(), report.deferred());
            }
        } catch (RuntimeException e) {
            log.error("[SWEEP] pass failed", e);
        }
    }
}
