package com.flagship.pos_core.sale;

import com.flagship.pos_core.payment.PaymentInstruction;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.util.List;

@Value
@Builder
public class CompleteSaleCommand {
    PaymentType paymentType;
    @Singular
    List<PaymentInstruction> payments;
    BigDecimal discountAmount;
    BigDecimal taxAmount;
    String notes;
    /**
     * Manager override of a credit denial. Always audited.
     */
    boolean forceCredit;
}
