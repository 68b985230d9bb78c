package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.SaleType;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

@Value
public class ChangeTypeRequest {

    @NotNull(message = "Sale type is required")
    @JsonProperty("sale_type")
    SaleType saleType;
}
