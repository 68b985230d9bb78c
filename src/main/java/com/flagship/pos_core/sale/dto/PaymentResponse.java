package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.payment.PaymentEntity;
import com.flagship.pos_core.payment.PaymentMethod;
import com.flagship.pos_core.payment.PaymentStatus;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.UUID;

/**
 * A payment as returned by the payment endpoints.
 */
@Value
@Builder
public class PaymentResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sale_id")
    UUID saleId;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("payment_method")
    PaymentMethod paymentMethod;

    @JsonProperty("status")
    PaymentStatus status;

    @JsonProperty("reference")
    String reference;

    @JsonProperty("created_at")
    Instant createdAt;

    /**
     * Sale balance after this payment; absent when listing payments.
     */
    @JsonProperty("sale_status")
    SaleStatus saleStatus;

    @JsonProperty("sale_amount_due")
    BigDecimal saleAmountDue;

    public static PaymentResponse from(PaymentEntity payment) {
        return builderFor(payment).build();
    }

    public static PaymentResponse from(PaymentEntity payment, SaleEntity sale) {
        return builderFor(payment)
            .saleStatus(sale.getStatus())
            .saleAmountDue(sale.getAmountDue())
            .build();
    }

    private static PaymentResponseBuilder builderFor(PaymentEntity payment) {
        return PaymentResponse.builder()
            .id(payment.getId())
            .saleId(payment.getSaleId())
            .amountPaid(payment.getAmountPaid())
            .paymentMethod(payment.getPaymentMethod())
            .status(payment.getStatus())
            .reference(payment.getReference())
            .createdAt(payment.getCreatedAt());
    }
}
