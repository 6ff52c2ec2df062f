package com.example.fulfillment.application.port.out;

import java.util.concurrent.CompletableFuture;

/**
 * Outbound port for the messaging channel that reaches customers and
 * operators. Best-effort: callers never make a state change depend on it.
 */
public interface NotificationPort {

    /**
     * @param recipient chat id of the customer or operator
     * @param text      message body
     */
    CompletableFuture<Void> send(long recipient, String text);
}
