package com.flagship.investment_ledger.withdrawal;

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
public interface WithdrawalRequestRepository extends JpaRepository<WithdrawalRequestEntity, UUID> {

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT w FROM WithdrawalRequestEntity w WHERE w.id = :id")
    Optional<WithdrawalRequestEntity> findByIdForUpdate(@Param("id") UUID id);

    Optional<WithdrawalRequestEntity> findByIdAndUserId(UUID id, UUID userId);

    List<WithdrawalRequestEntity> findByUserIdOrderByCreatedAtDesc(UUID userId);
}
