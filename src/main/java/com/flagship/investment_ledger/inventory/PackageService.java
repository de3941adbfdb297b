package com.flagship.investment_ledger.inventory;

import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.inventory.dto.CreatePackageRequest;
import com.flagship.investment_ledger.inventory.dto.PackageStats;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Package catalogue: creation and read access.
 * Slot counts are never written here, only by {@link InventoryAllocator}.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PackageService {

    private final InvestmentPackageRepository repository;

    @Transactional
    public InvestmentPackage createPackage(CreatePackageRequest request) {
        InvestmentPackage pkg = InvestmentPackage.create(
            request.getName(),
            request.getKind(),
            request.getCategory(),
            request.getTotalSlots(),
            request.getMinAmount(),
            request.getMaxAmount(),
            request.getReturnRate(),
            request.getDurationDays(),
            request.getReservationMode()
        );
        InvestmentPackageEntity saved = repository.save(InvestmentPackageEntity.fromDomain(pkg));
        log.info("Created package: id={}, kind={}, slots={}, reservationMode={}",
                saved.getId(), saved.getKind(), saved.getTotalSlots(), saved.getReservationMode());
        return saved.toDomain();
    }

    @Transactional(readOnly = true)
    public InvestmentPackage getPackage(UUID packageId) {
        return repository.findById(packageId)
            .map(InvestmentPackageEntity::toDomain)
            .orElseThrow(() -> NotFoundException.of("Package", packageId));
    }

    /**
     * Lists active packages, optionally narrowed by kind and category.
     */
    @Transactional(readOnly = true)
    public List<InvestmentPackage> listActive(PackageKind kind, String category) {
        return repository.findByStatusOrderByCreatedAtDesc(PackageStatus.ACTIVE).stream()
            .map(InvestmentPackageEntity::toDomain)
            .filter(pkg -> kind == null || pkg.getKind() == kind)
            .filter(pkg -> category == null || category.equalsIgnoreCase(pkg.getCategory()))
            .toList();
    }

    @Transactional(readOnly = true)
    public PackageStats stats() {
        long totalSlots = repository.sumTotalSlots();
        long availableSlots = repository.sumAvailableSlots();
        return new PackageStats(
            repository.count(),
            repository.countByStatus(PackageStatus.ACTIVE),
            totalSlots,
            availableSlots,
            totalSlots - availableSlots
        );
    }
}
