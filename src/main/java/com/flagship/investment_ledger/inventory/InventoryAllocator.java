package com.flagship.investment_ledger.inventory;

import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.observability.InvestmentMetrics;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.PessimisticLockingFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.UUID;

/**
 * Slot accounting for investment packages.
 *
 * Every mutation is a locked read (SELECT ... FOR UPDATE) followed by a write,
 * inside the caller's transaction. The locked row is refreshed so a package
 * read earlier in the same persistence context cannot hide committed changes. The lock wait is bounded by
 * {@code inventory.lock-timeout-ms}; a timeout surfaces as {@link SlotContentionException}.
 *
 * Reservation follows the package's {@link ReservationMode}:
 * - AT_ORDER: {@link #reserve} takes the slots, {@link #commit} is bookkeeping only
 * - AT_PAYMENT: {@link #reserve} only checks availability, {@link #commit} takes the slots
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryAllocator {

    private final InvestmentPackageRepository repository;
    private final JdbcTemplate jdbcTemplate;
    private final EntityManager entityManager;
    private final InvestmentMetrics metrics;

    @Value("${inventory.lock-timeout-ms:3000}")
    private long lockTimeoutMs;

    /**
     * Order-time reservation.
     *
     * @return token telling whether slots are now held for the order
     * @throws OutOfStockException if the package is inactive or exhausted
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public ReservationToken reserve(UUID packageId, int units) {
        InvestmentPackageEntity entity = lockPackage(packageId);
        InvestmentPackage pkg = entity.toDomain();

        if (!pkg.reservesAtOrder()) {
            take(pkg, units);
            log.debug("Deferred reservation: package={}, units={}, available={}",
                    packageId, units, pkg.getAvailableSlots());
            return ReservationToken.deferred(packageId, units);
        }

        InvestmentPackage updated = take(pkg, units);
        entity.updateFromDomain(updated);
        repository.save(entity);

        log.info("Reserved slots: package={}, units={}, remaining={}",
                packageId, units, updated.getAvailableSlots());
        return ReservationToken.held(packageId, units);
    }

    /**
     * Payment-time commit.
     *
     * @param alreadyHeld true when the order reserved its slots at creation
     * @return the package as of the commit
     * @throws OutOfStockException if slots must be taken now and none are left
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public InvestmentPackage commit(UUID packageId, int units, boolean alreadyHeld) {
        if (alreadyHeld) {
            log.debug("Commit on held reservation, nothing to take: package={}, units={}", packageId, units);
            return repository.findById(packageId)
                .map(InvestmentPackageEntity::toDomain)
                .orElseThrow(() -> NotFoundException.of("Package", packageId));
        }

        InvestmentPackageEntity entity = lockPackage(packageId);
        InvestmentPackage updated = take(entity.toDomain(), units);
        entity.updateFromDomain(updated);
        repository.save(entity);

        log.info("Committed slots: package={}, units={}, remaining={}",
                packageId, units, updated.getAvailableSlots());
        return updated;
    }

    /**
     * Returns held slots to availability.
     *
     * @throws IllegalStateException if availability would exceed the package total
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public void release(UUID packageId, int units) {
        InvestmentPackageEntity entity = lockPackage(packageId);
        InvestmentPackage updated = entity.toDomain().returnSlots(units);
        entity.updateFromDomain(updated);
        repository.save(entity);

        log.info("Released slots: package={}, units={}, available={}",
                packageId, units, updated.getAvailableSlots());
    }

    private InvestmentPackage take(InvestmentPackage pkg, int units) {
        try {
            return pkg.takeSlots(units);
        } catch (OutOfStockException e) {
            metrics.recordOutOfStock();
            throw e;
        }
    }

    private InvestmentPackageEntity lockPackage(UUID packageId) {
        try {
            jdbcTemplate.execute("SET LOCAL lock_timeout = '" + lockTimeoutMs + "ms'");
            InvestmentPackageEntity entity = repository.findByIdForUpdate(packageId)
                .orElseThrow(() -> NotFoundException.of("Package", packageId));
            entityManager.refresh(entity);
            return entity;
        } catch (PessimisticLockingFailureException e) {
            metrics.recordSlotContention();
            log.warn("Inventory lock wait exceeded {}ms: package={}", lockTimeoutMs, packageId);
            throw new SlotContentionException(packageId, e);
        }
    }
}
