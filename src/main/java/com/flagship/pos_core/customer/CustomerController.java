package com.flagship.pos_core.customer;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Read-only view of a customer's credit account and its history.
 */
@RestController
@RequestMapping("/api/customers")
@RequiredArgsConstructor
public class CustomerController {

    private final CreditGuard creditGuard;

    @GetMapping("/{id}/credit")
    public ResponseEntity<CreditStatus> getCreditStatus(
            @RequestHeader("X-Business-Id") UUID businessId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(creditGuard.creditStatus(businessId, id));
    }

    @GetMapping("/{id}/credit/transactions")
    public ResponseEntity<List<CreditTransactionResponse>> getCreditTransactions(
            @RequestHeader("X-Business-Id") UUID businessId,
            @PathVariable("id") UUID id) {
        return ResponseEntity.ok(creditGuard.transactions(businessId, id).stream()
            .map(CreditTransactionResponse::from)
            .toList());
    }

    @Value
    public static class CreditTransactionResponse {

        @JsonProperty("id")
        UUID id;

        @JsonProperty("transaction_type")
        CreditTransactionType transactionType;

        @JsonProperty("amount")
        BigDecimal amount;

        @JsonProperty("balance_before")
        BigDecimal balanceBefore;

        @JsonProperty("balance_after")
        BigDecimal balanceAfter;

        @JsonProperty("reference_id")
        UUID referenceId;

        @JsonProperty("description")
        String description;

        @JsonProperty("created_at")
        Instant createdAt;

        static CreditTransactionResponse from(CreditTransactionEntity tx) {
            return new CreditTransactionResponse(tx.getId(), tx.getTransactionType(), tx.getAmount(),
                tx.getBalanceBefore(), tx.getBalanceAfter(), tx.getReferenceId(), tx.getDescription(),
                tx.getCreatedAt());
        }
    }
}
