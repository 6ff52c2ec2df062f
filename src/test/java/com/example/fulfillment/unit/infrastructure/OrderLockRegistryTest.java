package com.example.fulfillment.unit.infrastructure;

import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.concurrency.OrderLockRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

@DisplayName("OrderLockRegistry Tests")
class OrderLockRegistryTest {

    @Test
    @DisplayName("should_serialize_work_on_the_same_order")
    void should_serialize_work_on_the_same_order() throws Exception {
        // Given
        OrderLockRegistry registry = new OrderLockRegistry(16);
        OrderId orderId = OrderId.generate();
        AtomicInteger inside = new AtomicInteger();
        AtomicInteger maxInside = new AtomicInteger();
        int threads = 8;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        // When
        try {
            for (int i = 0; i < threads; i++) {
                futures.add(executor.submit(() -> {
                    start.await();
                    registry.withLock(orderId, () -> {
                        int now = inside.incrementAndGet();
                        maxInside.accumulateAndGet(now, Math::max);
                        sleepQuietly(20);
                        inside.decrementAndGet();
                    });
                    return null;
                }));
            }
            start.countDown();
            for (Future<?> future : futures) {
                future.get(10, TimeUnit.SECONDS);
            }
        } finally {
            executor.shutdownNow();
        }

        // Then
        assertThat(maxInside.get()).isEqualTo(1);
        assertThat(registry.getActiveHolders()).isZero();
    }

    @Test
    @DisplayName("should_be_reentrant_for_nested_calls")
    void should_be_reentrant_for_nested_calls() {
        OrderLockRegistry registry = new OrderLockRegistry(1);
        OrderId orderId = OrderId.generate();

        String result = registry.withLock(orderId, () -> registry.withLock(orderId, () -> "nested"));

        assertThat(result).isEqualTo("nested");
    }

    @Test
    @DisplayName("should_release_lock_when_action_throws")
    void should_release_lock_when_action_throws() {
        OrderLockRegistry registry = new OrderLockRegistry(1);
        OrderId orderId = OrderId.generate();

        assertThatThrownBy(() -> registry.withLock(orderId, () -> {
            throw new IllegalStateException("boom");
        })).isInstanceOf(IllegalStateException.class);

        assertThat(registry.getActiveHolders()).isZero();
        assertThat(registry.withLock(orderId, () -> 1)).isEqualTo(1);
    }

    @Test
    @DisplayName("should_flag_shutdown")
    void should_flag_shutdown() {
        OrderLockRegistry registry = new OrderLockRegistry(4);

        assertThat(registry.isShuttingDown()).isFalse();
        registry.beginShutdown();
        assertThat(registry.isShuttingDown()).isTrue();
    }

    @Test
    @DisplayName("should_reject_non_positive_stripe_count")
    void should_reject_non_positive_stripe_count() {
        assertThatThrownBy(() -> new OrderLockRegistry(0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static void sleepQuietly(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
