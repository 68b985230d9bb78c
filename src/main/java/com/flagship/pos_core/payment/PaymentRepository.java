package com.flagship.pos_core.payment;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Payments against a sale. Idempotency keys are looked up per business.
 */
@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByBusinessIdAndIdempotencyKey(UUID businessId, String idempotencyKey);

    List<PaymentEntity> findBySaleIdOrderByCreatedAtAsc(UUID saleId);

    @Query("""
        SELECT COALESCE(SUM(p.amountPaid), 0) FROM PaymentEntity p
        WHERE p.saleId = :saleId
          AND p.status = com.flagship.pos_core.payment.PaymentStatus.SUCCESSFUL
        """)
    BigDecimal sumSuccessfulBySaleId(@Param("saleId") UUID saleId);
}
