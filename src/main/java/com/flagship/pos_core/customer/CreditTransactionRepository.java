package com.flagship.pos_core.customer;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface CreditTransactionRepository extends JpaRepository<CreditTransactionEntity, UUID> {

    List<CreditTransactionEntity> findByCustomerIdOrderByCreatedAtAsc(UUID customerId);

    List<CreditTransactionEntity> findByReferenceIdOrderByCreatedAtAsc(UUID referenceId);
}
