package com.example.fulfillment.infrastructure.adapter.in.web;

import com.example.fulfillment.application.dto.OrderStatusView;
import com.example.fulfillment.application.dto.ShipmentView;
import com.example.fulfillment.application.port.in.OperatorActionsUseCase;
import com.example.fulfillment.application.port.in.RequestShipmentUseCase;
import com.example.fulfillment.domain.model.OrderId;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.ShipmentResolutionRequest;
import com.example.fulfillment.infrastructure.adapter.in.web.dto.TrackingUpdateRequest;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.concurrent.Callable;

/**
 * Operator actions on orders. Every action goes through the same
 * transition checks as the automated paths.
 */
@RestController
@RequestMapping("/api/admin/orders/{orderId}")
@Tag(name = "Operator", description = "Assembly, shipment, archiving and tracking overrides")
public class AdminOrderController {

    private final OperatorActionsUseCase operatorActions;
    private final RequestShipmentUseCase requestShipmentUseCase;

    public AdminOrderController(OperatorActionsUseCase operatorActions, RequestShipmentUseCase requestShipmentUseCase) {
        this.operatorActions = operatorActions;
        this.requestShipmentUseCase = requestShipmentUseCase;
    }

    @Operation(summary = "Mark assembled", description = "PAID_FULL to ASSEMBLED")
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Order assembled"),
            @ApiResponse(responseCode = "409", description = "Order is not fully paid")
    })
    @PostMapping("/assemble")
    public Mono<ResponseEntity<OrderStatusView>> assemble(
            @Parameter(description = "Order id", required = true) @PathVariable String orderId) {
        return blocking(() -> operatorActions.assemble(OrderId.of(orderId)));
    }

    @Operation(
            summary = "Hand over to the carrier",
            description = """
                    Creates the carrier shipment for an ASSEMBLED order, at most once.
                    A repeated call returns the existing shipment. On carrier failure the order stays ASSEMBLED.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Shipment created or already present"),
            @ApiResponse(responseCode = "409", description = "Order is not assembled"),
            @ApiResponse(responseCode = "502", description = "Carrier call failed, retry manually")
    })
    @PostMapping("/shipment")
    public Mono<ResponseEntity<ShipmentView>> requestShipment(
            @Parameter(description = "Order id", required = true) @PathVariable String orderId) {
        return blocking(() -> requestShipmentUseCase.requestShipment(OrderId.of(orderId)));
    }

    @Operation(
            summary = "Resolve an unfinished carrier request",
            description = """
                    For a shipment request whose carrier call ended without a known outcome.
                    With a carrierId the order is marked SHIPPED without calling the carrier;
                    without one the request is released so the shipment can be requested again.
                    """
    )
    @ApiResponses(value = {
            @ApiResponse(responseCode = "200", description = "Request resolved"),
            @ApiResponse(responseCode = "409", description = "No unfinished request, or order not assembled")
    })
    @PostMapping("/shipment/resolve")
    public Mono<ResponseEntity<ShipmentView>> resolveShipment(
            @Parameter(description = "Order id", required = true) @PathVariable String orderId,
            @Valid @RequestBody(required = false) ShipmentResolutionRequest request) {
        String carrierId = request != null ? request.carrierId() : null;
        return blocking(() -> requestShipmentUseCase.resolveUnknownOutcome(OrderId.of(orderId), carrierId));
    }

    @Operation(summary = "Archive", description = "SHIPPED to ARCHIVED")
    @PostMapping("/archive")
    public Mono<ResponseEntity<OrderStatusView>> archive(
            @Parameter(description = "Order id", required = true) @PathVariable String orderId) {
        return blocking(() -> operatorActions.archive(OrderId.of(orderId)));
    }

    @Operation(summary = "Override tracking number", description = "Shipped orders only; the owner is notified")
    @PutMapping("/tracking")
    public Mono<ResponseEntity<OrderStatusView>> overrideTracking(
            @Parameter(description = "Order id", required = true) @PathVariable String orderId,
            @Valid @RequestBody TrackingUpdateRequest request) {
        return blocking(() -> operatorActions.overrideTracking(OrderId.of(orderId), request.trackingNumber()));
    }

    private static <T> Mono<ResponseEntity<T>> blocking(Callable<T> action) {
        return Mono.fromCallable(action)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
