package com.flagship.investment_ledger.inventory;

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
public interface InvestmentPackageRepository extends JpaRepository<InvestmentPackageEntity, UUID> {

    /**
     * Loads a package with a row lock (SELECT ... FOR UPDATE).
     * All slot mutations go through this query.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT p FROM InvestmentPackageEntity p WHERE p.id = :id")
    Optional<InvestmentPackageEntity> findByIdForUpdate(@Param("id") UUID id);

    List<InvestmentPackageEntity> findByStatusOrderByCreatedAtDesc(PackageStatus status);

    @Query("SELECT COALESCE(SUM(p.totalSlots), 0) FROM InvestmentPackageEntity p")
    long sumTotalSlots();

    @Query("SELECT COALESCE(SUM(p.availableSlots), 0) FROM InvestmentPackageEntity p")
    long sumAvailableSlots();

    long countByStatus(PackageStatus status);
}
