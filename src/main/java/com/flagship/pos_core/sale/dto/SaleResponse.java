package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.PaymentType;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleStatus;
import com.flagship.pos_core.sale.SaleType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Sale header with its lines. Amounts are the persisted totals, never
 * recomputed on read.
 */
@Value
@Builder
public class SaleResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("business_id")
    UUID businessId;

    @JsonProperty("storefront_id")
    UUID storefrontId;

    @JsonProperty("cashier_id")
    UUID cashierId;

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("sale_type")
    SaleType saleType;

    @JsonProperty("status")
    SaleStatus status;

    @JsonProperty("payment_type")
    PaymentType paymentType;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_amount")
    BigDecimal totalAmount;

    @JsonProperty("amount_paid")
    BigDecimal amountPaid;

    @JsonProperty("amount_due")
    BigDecimal amountDue;

    @JsonProperty("amount_refunded")
    BigDecimal amountRefunded;

    @JsonProperty("receipt_number")
    String receiptNumber;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("items")
    List<SaleItemResponse> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @JsonProperty("completed_at")
    Instant completedAt;

    public static SaleResponse from(SaleEntity sale) {
        return SaleResponse.builder()
            .id(sale.getId())
            .businessId(sale.getBusinessId())
            .storefrontId(sale.getStorefrontId())
            .cashierId(sale.getCashierId())
            .customerId(sale.getCustomerId())
            .saleType(sale.getSaleType())
            .status(sale.getStatus())
            .paymentType(sale.getPaymentType())
            .subtotal(sale.getSubtotal())
            .discountAmount(sale.getDiscountAmount())
            .taxAmount(sale.getTaxAmount())
            .totalAmount(sale.getTotalAmount())
            .amountPaid(sale.getAmountPaid())
            .amountDue(sale.getAmountDue())
            .amountRefunded(sale.getAmountRefunded())
            .receiptNumber(sale.getReceiptNumber())
            .notes(sale.getNotes())
            .items(sale.getItems().stream().map(SaleItemResponse::from).toList())
            .createdAt(sale.getCreatedAt())
            .completedAt(sale.getCompletedAt())
            .build();
    }
}
