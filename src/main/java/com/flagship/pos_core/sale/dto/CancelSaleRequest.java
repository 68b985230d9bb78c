package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotBlank;
import lombok.Value;

@Value
public class CancelSaleRequest {

    @NotBlank(message = "Reason is required")
    @JsonProperty("reason")
    String reason;
}
