package com.flagship.pos_core.payment;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.customer.CreditGuard;
import com.flagship.pos_core.exception.InvalidStateTransitionException;
import com.flagship.pos_core.exception.OverpaymentRejectedException;
import com.flagship.pos_core.observability.SaleMetrics;
import com.flagship.pos_core.payment.PaymentLedger.PaymentRecording;
import com.flagship.pos_core.sale.PaymentType;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleRepository;
import com.flagship.pos_core.sale.SaleStatus;
import com.flagship.pos_core.sale.SaleType;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Payments against a credit sale of 50.00.
 */
@ExtendWith(MockitoExtension.class)
class PaymentLedgerTest {

    private static final Instant NOW = Instant.parse("2024-03-01T10:00:00Z");

    @Mock
    private PaymentRepository paymentRepository;

    @Mock
    private SaleRepository saleRepository;

    @Mock
    private IdempotencyService idempotencyService;

    @Mock
    private CreditGuard creditGuard;

    @Mock
    private AuditLog auditLog;

    private PaymentLedger paymentLedger;
    private SaleContext ctx;
    private UUID customerId;
    private SaleEntity sale;

    @BeforeEach
    void setUp() {
        paymentLedger = new PaymentLedger(paymentRepository, saleRepository, idempotencyService, creditGuard,
            auditLog, new SaleMetrics(new SimpleMeterRegistry()), Clock.fixed(NOW, ZoneOffset.UTC));

        ctx = SaleContext.of(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID());
        customerId = UUID.randomUUID();
        sale = SaleEntity.open(ctx.getBusinessId(), ctx.getStorefrontId(), ctx.getActorId(),
            customerId, SaleType.RETAIL, NOW);
        sale.addItem(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 1, new BigDecimal("50.00"),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, NOW);
        sale.chooseSettlement(PaymentType.CREDIT, NOW);
        sale.finalizeCompletion("RCP-20240301-000001", NOW);

        lenient().when(saleRepository.findByIdAndBusinessIdForUpdate(sale.getId(), ctx.getBusinessId()))
            .thenReturn(Optional.of(sale));
        lenient().when(paymentRepository.save(any(PaymentEntity.class)))
            .thenAnswer(invocation -> invocation.getArgument(0));
    }

    @Test
    @DisplayName("PENDING 50.00: paying 30.00 gives PARTIAL, paying 20.00 more gives COMPLETED")
    void paymentsReclassifyCreditSale() {
        assertEquals(SaleStatus.PENDING, sale.getStatus());

        PaymentRecording first = paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("30.00"),
            PaymentMethod.CASH, null, "pay-1");

        assertFalse(first.isDuplicate());
        assertEquals(SaleStatus.PARTIAL, sale.getStatus());
        assertEquals(new BigDecimal("20.00"), sale.getAmountDue());
        verify(creditGuard).recordCreditPayment(eq(ctx), eq(customerId), eq(sale.getId()),
            eq(new BigDecimal("30.00")), eq(first.getPayment().getId()), anyString());
        verify(idempotencyService).rememberAfterCommit(ctx.getBusinessId(), "pay-1", first.getPayment().getId());

        paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("20.00"),
            PaymentMethod.MOBILE, "MPESA-123", "pay-2");

        assertEquals(SaleStatus.COMPLETED, sale.getStatus());
        assertEquals(new BigDecimal("0.00"), sale.getAmountDue());
        assertEquals(new BigDecimal("50.00"), sale.getAmountPaid());
        verify(auditLog, times(2)).logEvent(eq(AuditLog.PAYMENT_RECORDED), eq(sale.getId()),
            eq(ctx.getActorId()), any(), anyString());
    }

    @Test
    void paymentAboveAmountDueIsRejected() {
        OverpaymentRejectedException e = assertThrows(OverpaymentRejectedException.class,
            () -> paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("50.01"),
                PaymentMethod.CARD, null, null));

        assertEquals("OVERPAYMENT_REJECTED", e.getCode());
        assertEquals(SaleStatus.PENDING, sale.getStatus());
        verify(paymentRepository, never()).save(any(PaymentEntity.class));
    }

    @Test
    @DisplayName("A repeated idempotency key returns the original payment without booking")
    void duplicateKeyReturnsOriginal() {
        PaymentEntity original = PaymentEntity.successful(ctx.getBusinessId(), sale.getId(),
            new BigDecimal("10.00"), PaymentMethod.CASH, null, "pay-1", ctx.getActorId(), NOW);
        when(idempotencyService.findExisting(ctx.getBusinessId(), "pay-1")).thenReturn(Optional.of(original));
        when(saleRepository.findByIdAndBusinessId(sale.getId(), ctx.getBusinessId())).thenReturn(Optional.of(sale));

        PaymentRecording recording = paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("10.00"),
            PaymentMethod.CASH, null, "pay-1");

        assertTrue(recording.isDuplicate());
        assertSame(original, recording.getPayment());
        assertEquals(new BigDecimal("0.00"), sale.getAmountPaid());
        verify(paymentRepository, never()).save(any(PaymentEntity.class));
    }

    @Test
    void keyReusedForAnotherSaleIsRejected() {
        PaymentEntity other = PaymentEntity.successful(ctx.getBusinessId(), UUID.randomUUID(),
            new BigDecimal("10.00"), PaymentMethod.CASH, null, "pay-1", ctx.getActorId(), NOW);
        when(idempotencyService.findExisting(ctx.getBusinessId(), "pay-1")).thenReturn(Optional.of(other));

        assertThrows(IllegalArgumentException.class, () -> paymentLedger.recordPayment(ctx, sale.getId(),
            new BigDecimal("10.00"), PaymentMethod.CASH, null, "pay-1"));
    }

    @Test
    @DisplayName("A retry that waited on the sale lock returns the payment booked while it waited")
    void keyBookedWhileWaitingOnLockIsReplayed() {
        PaymentEntity booked = PaymentEntity.successful(ctx.getBusinessId(), sale.getId(),
            new BigDecimal("10.00"), PaymentMethod.CASH, null, "pay-1", ctx.getActorId(), NOW);
        when(idempotencyService.findExisting(ctx.getBusinessId(), "pay-1")).thenReturn(Optional.empty());
        when(idempotencyService.findStored(ctx.getBusinessId(), "pay-1")).thenReturn(Optional.of(booked));

        PaymentRecording recording = paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("10.00"),
            PaymentMethod.CASH, null, "pay-1");

        assertTrue(recording.isDuplicate());
        assertSame(booked, recording.getPayment());
        assertEquals(SaleStatus.PENDING, sale.getStatus());
        verify(paymentRepository, never()).save(any(PaymentEntity.class));
        verify(creditGuard, never()).recordCreditPayment(any(), any(), any(), any(), any(), anyString());
    }

    @Test
    void settledSaleDoesNotAcceptPayments() {
        paymentLedger.recordPayment(ctx, sale.getId(), new BigDecimal("50.00"), PaymentMethod.CASH, null, null);

        assertThrows(InvalidStateTransitionException.class, () -> paymentLedger.recordPayment(ctx,
            sale.getId(), new BigDecimal("1.00"), PaymentMethod.CASH, null, null));
    }

    @Test
    void returnOffsetCannotBeRecordedByCallers() {
        assertThrows(IllegalArgumentException.class, () -> paymentLedger.recordPayment(ctx, sale.getId(),
            new BigDecimal("10.00"), PaymentMethod.RETURN_OFFSET, null, null));
    }

    @Test
    @DisplayName("Checkout tenders are booked one by one, each bounded by what is still due")
    void tendersAtCompletion() {
        SaleEntity draft = SaleEntity.open(ctx.getBusinessId(), ctx.getStorefrontId(), ctx.getActorId(),
            null, SaleType.RETAIL, NOW);
        draft.addItem(UUID.randomUUID(), UUID.randomUUID(), UUID.randomUUID(), 2, new BigDecimal("25.00"),
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO, NOW);

        List<PaymentEntity> booked = paymentLedger.applyAtCompletion(ctx, draft, List.of(
            new PaymentInstruction(new BigDecimal("30.00"), PaymentMethod.CASH, null),
            new PaymentInstruction(new BigDecimal("20.00"), PaymentMethod.CARD, "AUTH-1")));

        assertEquals(2, booked.size());
        assertEquals(new BigDecimal("50.00"), draft.getAmountPaid());
        assertEquals(new BigDecimal("0.00"), draft.getAmountDue());

        assertThrows(OverpaymentRejectedException.class, () -> paymentLedger.applyAtCompletion(ctx, draft,
            List.of(new PaymentInstruction(new BigDecimal("0.01"), PaymentMethod.CASH, null))));
    }
}
