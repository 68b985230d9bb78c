package com.flagship.pos_core.customer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Value;

import java.math.BigDecimal;
import java.util.UUID;

@Value
public class CreditStatus {

    @JsonProperty("customer_id")
    UUID customerId;

    @JsonProperty("credit_limit")
    BigDecimal creditLimit;

    @JsonProperty("outstanding_balance")
    BigDecimal outstandingBalance;

    @JsonProperty("available_credit")
    BigDecimal availableCredit;

    @JsonProperty("credit_terms_days")
    int creditTermsDays;

    @JsonProperty("credit_blocked")
    boolean creditBlocked;

    static CreditStatus of(CustomerEntity customer) {
        return new CreditStatus(
            customer.getId(),
            customer.getCreditLimit(),
            customer.getOutstandingBalance(),
            customer.getAvailableCredit(),
            customer.getCreditTermsDays(),
            customer.isCreditBlocked()
        );
    }
}
