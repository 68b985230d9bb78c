package com.flagship.pos_core.payment;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.customer.CreditGuard;
import com.flagship.pos_core.exception.InvalidStateTransitionException;
import com.flagship.pos_core.exception.OverpaymentRejectedException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.observability.CorrelationContext;
import com.flagship.pos_core.observability.SaleMetrics;
import com.flagship.pos_core.sale.Money;
import com.flagship.pos_core.sale.SaleEntity;
import com.flagship.pos_core.sale.SaleRepository;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Books money against sales.
 *
 * A payment is never larger than what is still due at the moment it is
 * booked, which keeps amount_paid + amount_due == total_amount and rules out
 * overpayment regardless of how many tenders are applied.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentLedger {

    private final PaymentRepository paymentRepository;
    private final SaleRepository saleRepository;
    private final IdempotencyService idempotencyService;
    private final CreditGuard creditGuard;
    private final AuditLog auditLog;
    private final SaleMetrics saleMetrics;
    private final Clock clock;

    /**
     * Result of {@link #recordPayment}. {@code duplicate} is true when the
     * idempotency key was seen before and nothing new was booked.
     */
    @Value
    public static class PaymentRecording {
        PaymentEntity payment;
        SaleEntity sale;
        boolean duplicate;
    }

    /**
     * Books checkout tenders on a DRAFT sale, one at a time, each bounded by
     * the running amount due.
     *
     * @throws OverpaymentRejectedException if a tender exceeds what is left
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<PaymentEntity> applyAtCompletion(SaleContext ctx, SaleEntity sale, List<PaymentInstruction> tenders) {
        Instant now = clock.instant();
        List<PaymentEntity> booked = new ArrayList<>();
        for (PaymentInstruction tender : tenders) {
            BigDecimal amount = Money.of(tender.getAmount());
            requireTender(tender, amount);
            if (amount.compareTo(sale.getAmountDue()) > 0) {
                throw new OverpaymentRejectedException(sale.getId(), sale.getAmountDue(), amount);
            }
            sale.applyPayment(amount, now);
            booked.add(paymentRepository.save(PaymentEntity.successful(
                ctx.getBusinessId(), sale.getId(), amount, tender.getMethod(),
                tender.getReference(), null, ctx.getActorId(), now)));
            saleMetrics.recordPayment(tender.getMethod().name());
        }
        return booked;
    }

    /**
     * Records a payment on a PENDING or PARTIAL sale and reclassifies it.
     * Payments on credit sales also lower the customer's outstanding balance.
     *
     * @throws InvalidStateTransitionException if the sale does not accept payments
     * @throws OverpaymentRejectedException if nothing is due or amount exceeds the due
     */
    @Transactional
    public PaymentRecording recordPayment(SaleContext ctx, UUID saleId, BigDecimal amount, PaymentMethod method,
                                          String reference, String idempotencyKey) {
        Optional<PaymentEntity> existing = idempotencyService.findExisting(ctx.getBusinessId(), idempotencyKey);
        if (existing.isPresent()) {
            requireSameSale(existing.get(), saleId, idempotencyKey);
            SaleEntity sale = saleRepository.findByIdAndBusinessId(saleId, ctx.getBusinessId())
                .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
            return replay(existing.get(), sale, idempotencyKey);
        }

        BigDecimal value = Money.of(amount);
        requireTender(new PaymentInstruction(value, method, reference), value);

        SaleEntity sale = saleRepository.findByIdAndBusinessIdForUpdate(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        CorrelationContext.putSale(ctx.getBusinessId(), saleId);

        // a retry holding the lock before us may have booked the key meanwhile
        Optional<PaymentEntity> bookedMeanwhile = idempotencyService.findStored(ctx.getBusinessId(), idempotencyKey);
        if (bookedMeanwhile.isPresent()) {
            requireSameSale(bookedMeanwhile.get(), saleId, idempotencyKey);
            return replay(bookedMeanwhile.get(), sale, idempotencyKey);
        }

        if (!sale.getStatus().acceptsPayments()) {
            throw new InvalidStateTransitionException(saleId, sale.getStatus(), "record_payment");
        }
        if (sale.getAmountDue().signum() == 0 || value.compareTo(sale.getAmountDue()) > 0) {
            saleMetrics.recordRejection("OVERPAYMENT_REJECTED");
            throw new OverpaymentRejectedException(saleId, sale.getAmountDue(), value);
        }

        Instant now = clock.instant();
        PaymentEntity payment = paymentRepository.save(PaymentEntity.successful(
            ctx.getBusinessId(), saleId, value, method, reference, idempotencyKey, ctx.getActorId(), now));
        sale.applyPayment(value, now);
        sale.reclassifyAfterPayment(now);

        if (sale.isCredit() && sale.getCustomerId() != null) {
            creditGuard.recordCreditPayment(ctx, sale.getCustomerId(), saleId, value, payment.getId(),
                "Payment towards sale " + sale.getReceiptNumber());
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("payment_id", payment.getId());
        payload.put("amount", value);
        payload.put("method", method);
        payload.put("amount_paid", sale.getAmountPaid());
        payload.put("amount_due", sale.getAmountDue());
        payload.put("status", sale.getStatus());
        auditLog.logEvent(AuditLog.PAYMENT_RECORDED, saleId, ctx.getActorId(), payload,
            "Payment of " + value + " recorded");

        idempotencyService.rememberAfterCommit(ctx.getBusinessId(), idempotencyKey, payment.getId());
        saleMetrics.recordPayment(method.name());

        log.info("Recorded payment {} of {} on sale {}: paid={}, due={}, status={}",
                payment.getId(), value, saleId, sale.getAmountPaid(), sale.getAmountDue(), sale.getStatus());
        return new PaymentRecording(payment, sale, false);
    }

    /**
     * Settles unpaid balance with the value of returned goods. Credit sales
     * also get a matching credit payment.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public PaymentEntity recordReturnOffset(SaleContext ctx, SaleEntity sale, BigDecimal amount, UUID refundId) {
        Instant now = clock.instant();
        BigDecimal value = Money.of(amount);
        PaymentEntity payment = paymentRepository.save(PaymentEntity.successful(
            ctx.getBusinessId(), sale.getId(), value, PaymentMethod.RETURN_OFFSET,
            "refund:" + refundId, null, ctx.getActorId(), now));
        sale.applyPayment(value, now);

        if (sale.isCredit() && sale.getCustomerId() != null) {
            creditGuard.recordCreditPayment(ctx, sale.getCustomerId(), sale.getId(), value, payment.getId(),
                "Return offset on sale " + sale.getReceiptNumber());
        }
        log.info("Return offset of {} applied to sale {}: due now {}", value, sale.getId(), sale.getAmountDue());
        return payment;
    }

    @Transactional(readOnly = true)
    public List<PaymentEntity> payments(SaleContext ctx, UUID saleId) {
        saleRepository.findByIdAndBusinessId(saleId, ctx.getBusinessId())
            .orElseThrow(() -> new ResourceNotFoundException("Sale", saleId));
        return paymentRepository.findBySaleIdOrderByCreatedAtAsc(saleId);
    }

    private static void requireSameSale(PaymentEntity payment, UUID saleId, String idempotencyKey) {
        if (!payment.getSaleId().equals(saleId)) {
            throw new IllegalArgumentException(
                "Idempotency key " + idempotencyKey + " was already used for another sale");
        }
    }

    private PaymentRecording replay(PaymentEntity payment, SaleEntity sale, String idempotencyKey) {
        log.info("Duplicate payment request for sale {} (idempotency key {}), returning payment {}",
                sale.getId(), idempotencyKey, payment.getId());
        return new PaymentRecording(payment, sale, true);
    }

    private void requireTender(PaymentInstruction tender, BigDecimal amount) {
        if (amount.signum() <= 0) {
            throw new IllegalArgumentException("Payment amount must be positive");
        }
        if (tender.getMethod() == null) {
            throw new IllegalArgumentException("Payment method is required");
        }
        if (tender.getMethod() == PaymentMethod.RETURN_OFFSET) {
            throw new IllegalArgumentException("RETURN_OFFSET payments are booked by refunds only");
        }
    }
}
