package com.flagship.investment_ledger.payment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface PaymentRepository extends JpaRepository<PaymentEntity, UUID> {

    Optional<PaymentEntity> findByReference(String reference);

    Optional<PaymentEntity> findByReferenceAndUserId(String reference, UUID userId);

    /**
     * Loads a payment by reference with a row lock.
     * First lock taken when applying a gateway outcome (payment, then investment, then package).
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.reference = :reference")
    Optional<PaymentEntity> findByReferenceForUpdate(@Param("reference") String reference);

    /**
     * Locks all payments of an investment, oldest first.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM PaymentEntity p WHERE p.investmentId = :investmentId ORDER BY p.createdAt ASC")
    List<PaymentEntity> findByInvestmentIdForUpdate(@Param("investmentId") UUID investmentId);

    List<PaymentEntity> findByInvestmentIdOrderByCreatedAtDesc(UUID investmentId);

    Optional<PaymentEntity> findFirstByInvestmentIdOrderByCreatedAtDesc(UUID investmentId);

    boolean existsByInvestmentIdAndStatus(UUID investmentId, PaymentStatus status);

    boolean existsByInvestmentIdAndStatusAndIdNot(UUID investmentId, PaymentStatus status, UUID id);
}
