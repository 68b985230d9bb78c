package com.flagship.pos_core.customer;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.exception.CreditLimitExceededException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.observability.SaleMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Credit exposure rules against a customer with a 100.00 limit.
 */
@ExtendWith(MockitoExtension.class)
class CreditGuardTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private CustomerRepository customerRepository;

    @Mock
    private CreditTransactionRepository transactionRepository;

    @Mock
    private AuditLog auditLog;

    private SimpleMeterRegistry meterRegistry;
    private CreditGuard creditGuard;
    private SaleContext ctx;
    private CustomerEntity customer;
    private UUID saleId;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        creditGuard = new CreditGuard(customerRepository, transactionRepository, auditLog,
            new SaleMetrics(meterRegistry), Clock.fixed(NOW, ZoneOffset.UTC));

        UUID businessId = UUID.randomUUID();
        ctx = SaleContext.of(businessId, UUID.randomUUID(), UUID.randomUUID());
        customer = CustomerEntity.register(businessId, "Acme Hardware", new BigDecimal("100.00"), 30, NOW);
        customer.charge(new BigDecimal("80.00"), NOW);
        saleId = UUID.randomUUID();
    }

    private void customerIsLockable() {
        when(customerRepository.findByIdForUpdate(customer.getId(), ctx.getBusinessId()))
            .thenReturn(Optional.of(customer));
    }

    @Nested
    @DisplayName("canPurchase")
    class CanPurchase {

        @Test
        @DisplayName("80 outstanding + 30 requested exceeds a 100 limit")
        void deniesOverLimit() {
            customerIsLockable();

            CreditDecision decision = creditGuard.canPurchase(ctx, customer.getId(), saleId,
                new BigDecimal("30.00"), false);

            assertFalse(decision.isAllowed());
            assertFalse(decision.isOverridden());
            assertTrue(decision.getReason().contains("exceeds credit limit"));
            assertEquals(new BigDecimal("80.00"), decision.getOutstandingBalance());
            verify(auditLog, never()).logEvent(anyString(), any(), any(), anyMap(), anyString());
        }

        @Test
        @DisplayName("Exposure exactly at the limit is allowed")
        void allowsUpToLimit() {
            customerIsLockable();

            CreditDecision decision = creditGuard.canPurchase(ctx, customer.getId(), saleId,
                new BigDecimal("20.00"), false);

            assertTrue(decision.isAllowed());
            assertFalse(decision.isOverridden());
        }

        @Test
        @DisplayName("Forced override allows the sale and leaves an audit trail")
        void forcedOverride() {
            customerIsLockable();

            CreditDecision decision = creditGuard.canPurchase(ctx, customer.getId(), saleId,
                new BigDecimal("30.00"), true);

            assertTrue(decision.isAllowed());
            assertTrue(decision.isOverridden());
            verify(auditLog).logEvent(eq(AuditLog.CREDIT_OVERRIDE), eq(saleId), eq(ctx.getActorId()),
                anyMap(), anyString());
            assertEquals(1.0, meterRegistry.get("pos.credit.overrides").counter().count());
        }

        @Test
        void blockedCustomerIsDenied() {
            customer.block(NOW);
            customerIsLockable();

            CreditDecision decision = creditGuard.canPurchase(ctx, customer.getId(), saleId,
                new BigDecimal("1.00"), false);

            assertFalse(decision.isAllowed());
            assertEquals("Customer credit is blocked", decision.getReason());
        }

        @Test
        void requirePurchaseThrowsOnDenial() {
            customerIsLockable();

            CreditLimitExceededException e = assertThrows(CreditLimitExceededException.class,
                () -> creditGuard.requirePurchase(ctx, customer.getId(), saleId, new BigDecimal("30.00"), false));

            assertEquals("CREDIT_LIMIT_EXCEEDED", e.getCode());
        }

        @Test
        void unknownCustomerIsNotFound() {
            UUID unknown = UUID.randomUUID();
            when(customerRepository.findByIdForUpdate(unknown, ctx.getBusinessId())).thenReturn(Optional.empty());

            assertThrows(ResourceNotFoundException.class,
                () -> creditGuard.canPurchase(ctx, unknown, saleId, BigDecimal.ONE, false));
        }
    }

    @Nested
    @DisplayName("credit ledger")
    class Ledger {

        @BeforeEach
        void saveReturnsEntry() {
            customerIsLockable();
            when(transactionRepository.save(any(CreditTransactionEntity.class)))
                .thenAnswer(invocation -> invocation.getArgument(0));
        }

        @Test
        void chargeRaisesBalanceAndRecordsBeforeAndAfter() {
            CreditTransactionEntity entry = creditGuard.chargeCredit(ctx, customer.getId(), saleId,
                new BigDecimal("15.00"));

            assertEquals(CreditTransactionType.CHARGE, entry.getTransactionType());
            assertEquals(new BigDecimal("80.00"), entry.getBalanceBefore());
            assertEquals(new BigDecimal("95.00"), entry.getBalanceAfter());
            assertEquals(saleId, entry.getReferenceId());
            assertEquals(new BigDecimal("95.00"), customer.getOutstandingBalance());
            verify(auditLog).logEvent(eq(AuditLog.CREDIT_CHARGED), eq(saleId), eq(ctx.getActorId()),
                anyMap(), anyString());
        }

        @Test
        @DisplayName("Payments lower the balance but never below zero")
        void paymentFloorsAtZero() {
            UUID paymentId = UUID.randomUUID();

            CreditTransactionEntity entry = creditGuard.recordCreditPayment(ctx, customer.getId(), saleId,
                new BigDecimal("90.00"), paymentId, "Payment towards sale");

            assertEquals(CreditTransactionType.PAYMENT, entry.getTransactionType());
            assertEquals(new BigDecimal("80.00"), entry.getBalanceBefore());
            assertEquals(new BigDecimal("0.00"), entry.getBalanceAfter());
            assertEquals(paymentId, entry.getReferenceId());
            assertEquals(new BigDecimal("100.00"), customer.getAvailableCredit());
        }
    }
}
