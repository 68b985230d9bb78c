package com.flagship.pos_core.sale;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface SaleRepository extends JpaRepository<SaleEntity, UUID> {

    /**
     * Row-locks the sale for the rest of the transaction. Every operation
     * that changes a sale starts here, so concurrent edits of one cart queue
     * up instead of overwriting each other's totals.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT s FROM SaleEntity s WHERE s.id = :id AND s.businessId = :businessId")
    Optional<SaleEntity> findByIdAndBusinessIdForUpdate(@Param("id") UUID id,
                                                       @Param("businessId") UUID businessId);

    @EntityGraph(attributePaths = "items")
    Optional<SaleEntity> findByIdAndBusinessId(UUID id, UUID businessId);
}
