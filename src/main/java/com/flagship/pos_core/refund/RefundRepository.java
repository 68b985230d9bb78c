package com.flagship.pos_core.refund;

import org.springframework.data.jpa.repository.EntityGraph;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface RefundRepository extends JpaRepository<RefundEntity, UUID> {

    @EntityGraph(attributePaths = "items")
    List<RefundEntity> findBySaleIdOrderByCreatedAtAsc(UUID saleId);
}
