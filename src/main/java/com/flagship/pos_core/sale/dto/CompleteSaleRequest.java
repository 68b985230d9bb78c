package com.flagship.pos_core.sale.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.flagship.pos_core.sale.CompleteSaleCommand;
import com.flagship.pos_core.sale.PaymentType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.NotNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
public class CompleteSaleRequest {

    @NotNull(message = "Payment type is required")
    @JsonProperty("payment_type")
    PaymentType paymentType;

    @Valid
    @JsonProperty("payments")
    List<PaymentInstructionRequest> payments;

    @DecimalMin(value = "0.00", message = "Discount must not be negative")
    @JsonProperty("discount_amount")
    BigDecimal discountAmount;

    @DecimalMin(value = "0.00", message = "Tax must not be negative")
    @JsonProperty("tax_amount")
    BigDecimal taxAmount;

    @JsonProperty("notes")
    String notes;

    @JsonProperty("force_credit")
    boolean forceCredit;

    public CompleteSaleCommand toCommand() {
        CompleteSaleCommand.CompleteSaleCommandBuilder builder = CompleteSaleCommand.builder()
            .paymentType(paymentType)
            .discountAmount(discountAmount)
            .taxAmount(taxAmount)
            .notes(notes)
            .forceCredit(forceCredit);
        if (payments != null) {
            payments.forEach(payment -> builder.payment(payment.toInstruction()));
        }
        return builder.build();
    }
}
