package com.example.fulfillment.infrastructure.adapter.in.web;

import com.example.fulfillment.application.port.in.HandlePaymentWebhookUseCase;
import com.example.fulfillment.application.port.in.HandlePaymentWebhookUseCase.WebhookOutcome;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.PaymentWebhookRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * Receives payment gateway notifications. Answers 200 for every parseable
 * notification, whatever the internal outcome, so the gateway never
 * redelivers an event the engine has already decided about.
 */
@RestController
@RequestMapping("/webhooks/payments")
@Tag(name = "Webhooks", description = "Payment gateway notifications")
public class PaymentWebhookController {

    private static final Logger log = LoggerFactory.getLogger(PaymentWebhookController.class);

    private final HandlePaymentWebhookUseCase webhookUseCase;
    private final OrderWebMapper mapper;

    public PaymentWebhookController(HandlePaymentWebhookUseCase webhookUseCase, OrderWebMapper mapper) {
        this.webhookUseCase = webhookUseCase;
        this.mapper = mapper;
    }

    @Operation(summary = "Payment notification", description = "payment.succeeded and payment.canceled are acted on")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Notification acknowledged"),
            @ApiResponse(responseCode = "400", description = "Body is not a notification"),
            @ApiResponse(responseCode = "403", description = "Origin not allowed")
    })
    @PostMapping
    public Mono<ResponseEntity<Map<String, String>>> receive(@RequestBody PaymentWebhookRequest request) {
        return Mono.fromCallable(() -> {
                    WebhookOutcome outcome = webhookUseCase.handle(mapper.toEvent(request));
                    log.info("Gateway event {} for payment {}: {}", request.event(),
                            request.object() != null ? request.object().id() : null, outcome);
                    return ResponseEntity.ok(Map.of("status", "ok"));
                })
                .subscribeOn(Schedulers.boundedElastic());
    }
}
