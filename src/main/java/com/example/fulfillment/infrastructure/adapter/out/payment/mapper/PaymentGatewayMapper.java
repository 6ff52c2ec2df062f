package com.example.fulfillment.infrastructure.adapter.out.payment.mapper;

import com.example.fulfillment.application.port.out.PaymentGatewayPort.GatewayPaymentStatus;
import com.example.fulfillment.application.port.out.PaymentGatewayPort.PaymentIntent;
import com.example.fulfillment.application.port.out.PaymentGatewayPort.PaymentIntentRequest;
import com.example.fulfillment.domain.model.Money;
import com.example.fulfillment.domain.model.PaymentKind;
import com.example.fulfillment.infrastructure.adapter.out.payment.dto.GatewayPaymentRequest;
import com.example.fulfillment.infrastructure.adapter.out.payment.dto.GatewayPaymentRequest.*;
import com.example.fulfillment.infrastructure.adapter.out.payment.dto.GatewayPaymentResponse;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Mapper between payment port types and gateway DTOs.
 */
@Component
public class PaymentGatewayMapper {

    public static final String METADATA_ORDER_ID = "order_id";
    public static final String METADATA_PAYMENT_KIND = "payment_kind";

    private final String returnUrl;
    private final int vatCode;

    public PaymentGatewayMapper(
            @Value("${fulfillment.payment.return-url:https://example.com/payment/return}") String returnUrl,
            @Value("${fulfillment.payment.vat-code:1}") int vatCode) {
        this.returnUrl = returnUrl;
        this.vatCode = vatCode;
    }

    public GatewayPaymentRequest toRequest(PaymentIntentRequest request) {
        Amount amount = toAmount(request.amount());
        // A prepayment is fiscalised as an advance; full and remainder payments settle the goods.
        String paymentMode = request.kind() == PaymentKind.PREPAY ? "full_prepayment" : "full_payment";

        Item item = new Item(request.description(), "1.00", amount, vatCode, paymentMode, "commodity");
        Customer customer = new Customer(
                request.customer().fullName(),
                request.customer().email(),
                request.customer().phone());

        return new GatewayPaymentRequest(
                amount,
                true,
                new Confirmation("redirect", returnUrl),
                request.description(),
                Map.of(
                        METADATA_ORDER_ID, request.orderId().getValue(),
                        METADATA_PAYMENT_KIND, request.kind().wireValue()),
                new Receipt(customer, List.of(item)));
    }

    public PaymentIntent toIntent(GatewayPaymentResponse response) {
        String confirmationUrl = response.confirmation() != null
                ? response.confirmation().confirmationUrl()
                : null;
        return new PaymentIntent(response.id(), confirmationUrl, toStatus(response.status()));
    }

    /**
     * Gateway statuses other than succeeded and canceled still await the payer.
     */
    public GatewayPaymentStatus toStatus(String status) {
        if ("succeeded".equalsIgnoreCase(status)) {
            return GatewayPaymentStatus.SUCCEEDED;
        }
        if ("canceled".equalsIgnoreCase(status)) {
            return GatewayPaymentStatus.FAILED;
        }
        return GatewayPaymentStatus.PENDING;
    }

    private static Amount toAmount(Money money) {
        return new Amount(money.toDecimalString(), money.getCurrency());
    }
}
