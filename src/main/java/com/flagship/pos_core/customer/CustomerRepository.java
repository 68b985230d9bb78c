package com.flagship.pos_core.customer;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface CustomerRepository extends JpaRepository<CustomerEntity, UUID> {

    /**
     * Serializes check-then-charge on one customer.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT c FROM CustomerEntity c WHERE c.id = :id AND c.businessId = :businessId")
    Optional<CustomerEntity> findByIdForUpdate(@Param("id") UUID id, @Param("businessId") UUID businessId);

    Optional<CustomerEntity> findByIdAndBusinessId(UUID id, UUID businessId);
}
