package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.payment.PaymentMethod;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Payment against a PENDING or PARTIAL sale. Retries repeat the same
 * Idempotency-Key header.
 */
@Value
public class RecordPaymentRequest {

    @NotNull(message = "Amount is required")
    @DecimalMin(value = "0.01", message = "Amount must be greater than 0")
    @JsonProperty("amount")
    BigDecimal amount;

    @NotNull(message = "Payment method is required")
    @JsonProperty("method")
    PaymentMethod method;

    @Size(max = 100)
    @JsonProperty("reference")
    String reference;
}
