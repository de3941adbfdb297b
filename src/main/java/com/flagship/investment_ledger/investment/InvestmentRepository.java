package com.flagship.investment_ledger.investment;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface InvestmentRepository extends JpaRepository<InvestmentEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT i FROM InvestmentEntity i WHERE i.id = :id")
    Optional<InvestmentEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<InvestmentEntity> findByIdAndUserId(UUID id, UUID userId);

    Optional<InvestmentEntity> findByIdempotencyKey(String idempotencyKey);

    List<InvestmentEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);

    List<InvestmentEntity> findByUserIdAndStatusOrderByCreatedAtDesc(UUID userId, InvestmentStatus status);

    @Query("""
        SELECT i FROM InvestmentEntity i
        WHERE i.userId = :userId AND i.status = :status AND i.withdrawalRequestId IS NULL
        ORDER BY i.completedDate ASC
        """)
    List<InvestmentEntity> findUnlinkedByStatus(@Param("userId") UUID userId,
                                                @Param("status") InvestmentStatus status);

    /**
     * Locks the user's investments in {@code status} that are not yet part of a withdrawal.
     * Rows are locked in id order.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("""
        SELECT i FROM InvestmentEntity i
        WHERE i.userId = :userId AND i.status = :status AND i.withdrawalRequestId IS NULL
        ORDER BY i.id
        """)
    List<InvestmentEntity> findUnlinkedByStatusForUpdate(@Param("userId") UUID userId,
                                                         @Param("status") InvestmentStatus status);

    /**
     * Links investments to a withdrawal request, skipping any already linked.
     *
     * @return number of investments linked by this call
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query(value = """
        UPDATE investments SET withdrawal_request_id = :withdrawalId, updated_at = CURRENT_TIMESTAMP
        WHERE id IN (:ids) AND withdrawal_request_id IS NULL
        """, nativeQuery = true)
    int linkToWithdrawal(@Param("withdrawalId") UUID withdrawalId, @Param("ids") Collection<UUID> ids);

    /**
     * Hard-deletes a user's investments in one status. Payments of deleted investments keep a null link.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("DELETE FROM InvestmentEntity i WHERE i.userId = :userId AND i.status = :status")
    int deleteByUserIdAndStatus(@Param("userId") UUID userId, @Param("status") InvestmentStatus status);
}
