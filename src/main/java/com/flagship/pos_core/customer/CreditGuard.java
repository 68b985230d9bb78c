package com.flagship.pos_core.customer;

import com.flagship.pos_core.audit.AuditLog;
import com.flagship.pos_core.context.SaleContext;
import com.flagship.pos_core.exception.CreditLimitExceededException;
import com.flagship.pos_core.exception.ResourceNotFoundException;
import com.flagship.pos_core.observability.SaleMetrics;
import com.flagship.pos_core.sale.Money;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Credit exposure checks and the customer credit ledger.
 *
 * Each method locks the customer row first, so a check and the charge that
 * follows it in the same transaction cannot interleave with another sale
 * for the same customer.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CreditGuard {

    private final CustomerRepository customerRepository;
    private final CreditTransactionRepository transactionRepository;
    private final AuditLog auditLog;
    private final SaleMetrics saleMetrics;
    private final Clock clock;

    /**
     * Decides whether the customer may take on {@code amount} more credit.
     *
     * Denied when credit is blocked or when outstanding + amount exceeds the
     * limit. With {@code force} a denial becomes an allowed, overridden
     * decision and a credit.override audit event is written for the sale.
     */
    @Transactional
    public CreditDecision canPurchase(SaleContext ctx, UUID customerId, UUID saleId,
                                      BigDecimal amount, boolean force) {
        CustomerEntity customer = lockCustomer(ctx.getBusinessId(), customerId);
        CreditDecision decision = CreditDecision.evaluate(customer, Money.of(amount));

        if (decision.isAllowed()) {
            return decision;
        }
        if (!force) {
            log.warn("Credit purchase denied: customerId={}, saleId={}, reason={}",
                    customerId, saleId, decision.getReason());
            return decision;
        }

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("customer_id", customerId);
        payload.put("credit_limit", decision.getCreditLimit());
        payload.put("outstanding_balance", decision.getOutstandingBalance());
        payload.put("requested", decision.getRequested());
        payload.put("denial_reason", decision.getReason());
        auditLog.logEvent(AuditLog.CREDIT_OVERRIDE, saleId, ctx.getActorId(), payload,
            "Credit limit overridden for customer " + customer.getName());
        saleMetrics.recordCreditOverride();

        log.warn("Credit limit overridden: customerId={}, saleId={}, actorId={}, reason={}",
                customerId, saleId, ctx.getActorId(), decision.getReason());
        return decision.overridden();
    }

    /**
     * {@link #canPurchase} that throws on denial.
     *
     * @throws CreditLimitExceededException when denied and not forced
     */
    @Transactional
    public CreditDecision requirePurchase(SaleContext ctx, UUID customerId, UUID saleId,
                                          BigDecimal amount, boolean force) {
        CreditDecision decision = canPurchase(ctx, customerId, saleId, amount, force);
        if (!decision.isAllowed()) {
            throw new CreditLimitExceededException(customerId, decision.getReason(),
                decision.getCreditLimit(), decision.getOutstandingBalance(), decision.getRequested());
        }
        return decision;
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public CreditTransactionEntity chargeCredit(SaleContext ctx, UUID customerId, UUID saleId, BigDecimal amount) {
        BigDecimal value = requirePositive(amount);
        Instant now = clock.instant();
        CustomerEntity customer = lockCustomer(ctx.getBusinessId(), customerId);

        BigDecimal before = customer.getOutstandingBalance();
        customer.charge(value, now);
        CreditTransactionEntity entry = transactionRepository.save(CreditTransactionEntity.record(
            customer, CreditTransactionType.CHARGE, value, before, saleId,
            "Credit sale " + saleId, ctx.getActorId(), now));

        auditLog.logEvent(AuditLog.CREDIT_CHARGED, saleId, ctx.getActorId(), Map.of(
            "customer_id", customerId,
            "amount", value,
            "balance_before", before,
            "balance_after", customer.getOutstandingBalance()
        ), "Credit charged to customer " + customer.getName());

        log.info("Charged {} to customer {} for sale {}: balance {} -> {}",
                value, customerId, saleId, before, customer.getOutstandingBalance());
        return entry;
    }

    /**
     * Lowers the balance after a payment or a return against a credit sale.
     * The balance is floored at zero.
     *
     * @param saleId sale the money was received against
     * @param referenceId payment the entry points to
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public CreditTransactionEntity recordCreditPayment(SaleContext ctx, UUID customerId, UUID saleId,
                                                       BigDecimal amount, UUID referenceId, String description) {
        BigDecimal value = requirePositive(amount);
        Instant now = clock.instant();
        CustomerEntity customer = lockCustomer(ctx.getBusinessId(), customerId);

        BigDecimal before = customer.getOutstandingBalance();
        customer.receivePayment(value, now);
        CreditTransactionEntity entry = transactionRepository.save(CreditTransactionEntity.record(
            customer, CreditTransactionType.PAYMENT, value, before, referenceId,
            description, ctx.getActorId(), now));

        auditLog.logEvent(AuditLog.CREDIT_PAYMENT, saleId, ctx.getActorId(), Map.of(
            "customer_id", customerId,
            "amount", value,
            "balance_before", before,
            "balance_after", customer.getOutstandingBalance()
        ), description);

        log.info("Credit payment of {} from customer {}: balance {} -> {}",
                value, customerId, before, customer.getOutstandingBalance());
        return entry;
    }

    @Transactional(readOnly = true)
    public CreditStatus creditStatus(UUID businessId, UUID customerId) {
        return CreditStatus.of(findCustomer(businessId, customerId));
    }

    @Transactional(readOnly = true)
    public List<CreditTransactionEntity> transactions(UUID businessId, UUID customerId) {
        findCustomer(businessId, customerId);
        return transactionRepository.findByCustomerIdOrderByCreatedAtAsc(customerId);
    }

    private CustomerEntity findCustomer(UUID businessId, UUID customerId) {
        return customerRepository.findByIdAndBusinessId(customerId, businessId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }

    private CustomerEntity lockCustomer(UUID businessId, UUID customerId) {
        return customerRepository.findByIdForUpdate(customerId, businessId)
            .orElseThrow(() -> new ResourceNotFoundException("Customer", customerId));
    }

    private BigDecimal requirePositive(BigDecimal amount) {
        BigDecimal value = Money.of(amount);
        if (value.signum() <= 0) {
            throw new IllegalArgumentException("Credit amount must be positive");
        }
        return value;
    }
}
