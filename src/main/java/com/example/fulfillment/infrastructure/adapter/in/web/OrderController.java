package com.example.fulfillment.infrastructure.adapter.in.web;

import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.application.dto.PaymentIntentView;
import com.example.fulfillment.application.port.in.ChangeDeliveryUseCase;
import com.example.fulfillment.application.port.in.CheckoutUseCase;
import com.example.fulfillment.application.port.in.GetOrderStatusUseCase;
import com.example.fulfillment.application.port.in.StartPaymentUseCase;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.domain.model.PaymentKind;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.CheckoutRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.DeliveryChangeRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.StartPaymentRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.mapper.OrderWebMapper;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * REST controller for the storefront: checkout, order status and payments.
 * Use cases block on the database and external calls, so they run on the
 * bounded elastic scheduler.
 */
@RestController
@RequestMapping("/api/orders")
@Tag(name = "Orders", description = "Checkout, order status and payments")
public class OrderController {

    private static final Logger log = LoggerFactory.getLogger(OrderController.class);

    private final CheckoutUseCase checkoutUseCase;
    private final GetOrderStatusUseCase getOrderStatusUseCase;
    private final StartPaymentUseCase startPaymentUseCase;
    private final ChangeDeliveryUseCase changeDeliveryUseCase;
    private final OrderWebMapper mapper;

    public OrderController(
            CheckoutUseCase checkoutUseCase,
            GetOrderStatusUseCase getOrderStatusUseCase,
            StartPaymentUseCase startPaymentUseCase,
            ChangeDeliveryUseCase changeDeliveryUseCase,
            OrderWebMapper mapper) {
        this.checkoutUseCase = checkoutUseCase;
        this.getOrderStatusUseCase = getOrderStatusUseCase;
        this.startPaymentUseCase = startPaymentUseCase;
        this.changeDeliveryUseCase = changeDeliveryUseCase;
        this.mapper = mapper;
    }

    @Operation(
            summary = "Confirm checkout",
            description = "Creates an order in NEW with the owner's contact data and delivery choice."
    )
    @ApiResponses(value = {
            @ApiResponse(
                    responseCode = "201",
                    description = "Order created",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = OrderStatusView.class))
            ),
            @ApiResponse(
                    responseCode = "400",
                    description = "Invalid checkout data",
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            examples = @ExampleObject(value = """
                                    {
                                      "error": "INVALID_REQUEST",
                                      "message": "pickupPointCode Pickup point code is required",
                                      "timestamp": "2026-02-02T12:00:00Z"
                                    }
                                    """))
            )
    })
    @PostMapping
    public Mono<ResponseEntity<OrderStatusView>> checkout(
            @io.swagger.v3.oas.annotations.parameters.RequestBody(
                    description = "Checkout confirmation",
                    required = true,
                    content = @Content(
                            mediaType = MediaType.APPLICATION_JSON_VALUE,
                            schema = @Schema(implementation = CheckoutRequest.class),
                            examples = @ExampleObject(value = """
                                    {
                                      "chatId": 123456789,
                                      "fullName": "Anna Ivanova",
                                      "phone": "+79001234567",
                                      "email": "anna@example.com",
                                      "totalAmount": 350000,
                                      "fulfillmentKind": "PREPAY_REMAINDER",
                                      "deliveryAddress": "Moscow, Tverskaya 1",
                                      "pickupPointCode": "MSK42",
                                      "postalCode": "125009",
                                      "deliveryCost": 39000,
                                      "deliveryPeriod": "2-4 days"
                                    }
                                    """)))
            @Valid @RequestBody CheckoutRequest request) {

        log.info("Received checkout for chat {}", request.chatId());

        return Mono.fromCallable(() -> checkoutUseCase.checkout(mapper.toCommand(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(view -> ResponseEntity.status(HttpStatus.CREATED).body(view));
    }

    @Operation(summary = "Get order status", description = "Status, amounts, payments and shipment of an order")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order found"),
            @ApiResponse(responseCode = "400", description = "Malformed order id"),
            @ApiResponse(responseCode = "404", description = "Order not found")
    })
    @GetMapping("/{orderId}")
    public Mono<ResponseEntity<OrderStatusView>> getOrder(
            @Parameter(description = "Order id", required = true)
            @PathVariable String orderId) {

        return Mono.fromCallable(() -> getOrderStatusUseCase.getStatus(OrderId.of(orderId)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(
            summary = "Start a payment",
            description = """
                    Creates a payment intent of the given kind and returns the confirmation URL.
                    If an attempt of the same kind is still pending, that attempt is returned instead.

                    - `full`: whole total, FULL orders
                    - `prepay`: prepayment share, PREPAY_REMAINDER orders
                    - `remainder`: rest of the total, PREPAY_REMAINDER orders after the prepayment
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Payment intent ready"),
            @ApiResponse(responseCode = "400", description = "Unknown or inapplicable payment kind"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order is not awaiting this payment"),
            @ApiResponse(responseCode = "502", description = "Payment gateway unavailable")
    })
    @PostMapping("/{orderId}/payments")
    public Mono<ResponseEntity<PaymentIntentView>> startPayment(
            @Parameter(description = "Order id", required = true)
            @PathVariable String orderId,
            @Valid @RequestBody StartPaymentRequest request) {

        return Mono.fromCallable(() -> {
                    PaymentKind kind = mapper.toPaymentKind(request.kind());
                    log.info("Payment requested for order {}: {}", orderId, kind.wireValue());
                    return startPaymentUseCase.startPayment(OrderId.of(orderId), kind);
                })
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @Operation(summary = "Change pickup point", description = "Allowed until the order is handed to the carrier")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Delivery updated, operators notified"),
            @ApiResponse(responseCode = "400", description = "Missing pickup point"),
            @ApiResponse(responseCode = "404", description = "Order not found"),
            @ApiResponse(responseCode = "409", description = "Order already shipped or closed")
    })
    @PutMapping("/{orderId}/delivery")
    public Mono<ResponseEntity<OrderStatusView>> changeDelivery(
            @Parameter(description = "Order id", required = true)
            @PathVariable String orderId,
            @Valid @RequestBody DeliveryChangeRequest request) {

        log.info("Delivery change requested for order {}", orderId);

        return Mono.fromCallable(() -> changeDeliveryUseCase.changeDelivery(
                        OrderId.of(orderId), mapper.toCommand(request)))
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
