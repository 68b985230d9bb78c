package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.refund.RefundLine;
import com.flagship.pos_core.refund.RefundType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.util.List;
import java.util.UUID;

@Value
public class RefundRequest {

    @NotEmpty(message = "At least one item is required")
    @Valid
    @JsonProperty("items")
    List<Item> items;

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;

    @JsonProperty("refund_type")
    RefundType refundType;

    @Value
    public static class Item {

        @NotNull(message = "Sale item ID is required")
        @JsonProperty("sale_item_id")
        UUID saleItemId;

        @Min(value = 1, message = "Quantity must be at least 1")
        @JsonProperty("quantity")
        int quantity;
    }

    public List<RefundLine> toLines() {
        return items.stream()
            .map(item -> new RefundLine(item.getSaleItemId(), item.getQuantity()))
            .toList();
    }
}
