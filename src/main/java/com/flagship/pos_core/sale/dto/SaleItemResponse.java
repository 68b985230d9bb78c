package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.SaleItemEntity;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
@Builder
public class SaleItemResponse {

    @JsonProperty("id")
    UUID id;

    @JsonProperty("product_id")
    UUID productId;

    @JsonProperty("stock_line_id")
    UUID stockLineId;

    @JsonProperty("reservation_id")
    UUID reservationId;

    @JsonProperty("quantity")
    int quantity;

    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @JsonProperty("discount_percentage")
    BigDecimal discountPercentage;

    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    @JsonProperty("subtotal")
    BigDecimal subtotal;

    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("total_price")
    BigDecimal totalPrice;

    @JsonProperty("refunded_quantity")
    int refundedQuantity;

    public static SaleItemResponse from(SaleItemEntity item) {
        return SaleItemResponse.builder()
            .id(item.getId())
            .productId(item.getProductId())
            .stockLineId(item.getStockLineId())
            .reservationId(item.getReservationId())
            .quantity(item.getQuantity())
            .unitPrice(item.getUnitPrice())
            .discountPercentage(item.getDiscountPercentage())
            .taxRate(item.getTaxRate())
            .subtotal(item.getSubtotal())
            .taxAmount(item.getTaxAmount())
            .totalPrice(item.getTotalPrice())
            .refundedQuantity(item.getRefundedQuantity())
            .build();
    }
}
