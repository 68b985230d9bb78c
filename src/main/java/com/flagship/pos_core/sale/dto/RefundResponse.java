package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.refund.RefundEntity;
import com.flagship.pos_core.refund.RefundItemEntity;
import com.flagship.pos_core.refund.RefundStatus;
import com.flagship.pos_core.refund.RefundType;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Value
@Builder
public class RefundResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("sale_id")
    UUID saleId;

    @JsonProperty("refund_type")
    RefundType refundType;

    @JsonProperty("amount")
    BigDecimal amount;

    @JsonProperty("offset_amount")
    BigDecimal offsetAmount;

    @JsonProperty("cash_amount")
    BigDecimal cashAmount;

    @JsonProperty("reason")
    String reason;

    @JsonProperty("status")
    RefundStatus status;

    @JsonProperty("items")
    List<Item> items;

    @JsonProperty("created_at")
    Instant createdAt;

    @Value
    public static class Item {

        @JsonProperty("sale_item_id")
        UUID saleItemId;

        @JsonProperty("quantity")
        int quantity;

        @JsonProperty("amount")
        BigDecimal amount;

        static Item from(RefundItemEntity item) {
            return new Item(item.getSaleItemId(), item.getQuantity(), item.getAmount());
        }
    }

    public static RefundResponse from(RefundEntity refund) {
        return RefundResponse.builder()
            .id(refund.getId())
            .saleId(refund.getSaleId())
            .refundType(refund.getRefundType())
            .amount(refund.getAmount())
            .offsetAmount(refund.getOffsetAmount())
            .cashAmount(refund.getCashAmount())
            .reason(refund.getReason())
            .status(refund.getStatus())
            .items(refund.getItems().stream().map(Item::from).toList())
            .createdAt(refund.getCreatedAt())
            .build();
    }
}
