package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.SaleType;
import lombok.Value;

import java.util.UUID;

@Value
public class OpenSaleRequest {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("sale_type")
    SaleType saleType;
}
