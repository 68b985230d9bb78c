package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.AddItemCommand;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

/**
 * Body of POST /api/sales/{id}/items. Prices and rates carry at most two
 * decimals; the unit price defaults to the stock line's price for the sale type.
 */
@Value
public class AddItemRequest {

    @JsonProperty("product_id")
    UUID productId;

    @NotNull(message = "Stock line ID is required")
    @JsonProperty("stock_line_id")
    UUID stockLineId;

    @Min(value = 1, message = "Quantity must be at least 1")
    @JsonProperty("quantity")
    int quantity;

    @DecimalMin(value = "0.00", message = "Unit price must not be negative")
    @Digits(integer = 17, fraction = 2, message = "Unit price must have at most 2 decimals")
    @JsonProperty("unit_price")
    BigDecimal unitPrice;

    @DecimalMin(value = "0.00", message = "Discount percentage must be between 0 and 100")
    @DecimalMax(value = "100.00", message = "Discount percentage must be between 0 and 100")
    @Digits(integer = 3, fraction = 2, message = "Discount percentage must have at most 2 decimals")
    @JsonProperty("discount_percentage")
    BigDecimal discountPercentage;

    @DecimalMin(value = "0.00", message = "Tax rate must be between 0 and 100")
    @DecimalMax(value = "100.00", message = "Tax rate must be between 0 and 100")
    @Digits(integer = 3, fraction = 2, message = "Tax rate must have at most 2 decimals")
    @JsonProperty("tax_rate")
    BigDecimal taxRate;

    public AddItemCommand toCommand() {
        return AddItemCommand.builder()
            .productId(productId)
            .stockLineId(stockLineId)
            .quantity(quantity)
            .unitPrice(unitPrice)
            .discountPercentage(discountPercentage)
            .taxRate(taxRate)
            .build();
    }
}
