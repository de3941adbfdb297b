package com.flagship.investment_ledger.investment;

import com.flagship.investment_ledger.exception.InvalidTransitionException;
import com.flagship.investment_ledger.exception.NotFoundException;
import com.flagship.investment_ledger.inventory.InventoryAllocator;
import com.flagship.investment_ledger.inventory.ReservationToken;
import com.flagship.investment_ledger.payment.Payment;
import com.flagship.investment_ledger.payment.PaymentPersistenceService;
import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges the Investment domain object and its JPA entity, and owns the
 * order-time unit of work (reserve inventory, store investment, store payment).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestmentPersistenceService {

    private final InvestmentRepository repository;
    private final InventoryAllocator allocator;
    private final PaymentPersistenceService paymentPersistence;
    private final EntityManager entityManager;

    /**
     * Reserves inventory and stores the pending investment with its first payment,
     * all or nothing.
     *
     * @throws com.flagship.investment_ledger.inventory.OutOfStockException if the package ran out meanwhile
     */
    @Transactional
    public Investment createPending(Investment investment, Payment payment) {
        ReservationToken token = allocator.reserve(investment.getPackageId(), investment.getUnits());

        Investment toSave = investment.toBuilder().slotHeld(token.isHeld()).build();
        InvestmentEntity saved = repository.save(InvestmentEntity.fromDomain(toSave));
        repository.flush();
        paymentPersistence.save(payment);

        log.info("Stored pending investment {} (slotHeld={}) with payment {}",
                saved.getId(), token.isHeld(), payment.getReference());
        return saved.toDomain();
    }

    /**
     * Adds a payment attempt to an investment that is still pending.
     */
    @Transactional
    public Payment addPaymentAttempt(UUID investmentId, Payment payment) {
        Investment investment = lock(investmentId)
            .orElseThrow(() -> NotFoundException.of("Investment", investmentId));
        if (!investment.isPending()) {
            throw new InvalidTransitionException(
                "Payment attempts are only accepted for PENDING investments", investment.getStatus());
        }
        return paymentPersistence.save(payment);
    }

    /**
     * Locks the row and reloads it, so the result reflects what the lock holder sees
     * even if the investment was read earlier in this transaction.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Investment> lock(UUID investmentId) {
        return repository.findByIdForUpdate(investmentId)
            .map(this::refreshed);
    }

    /**
     * Writes the lifecycle fields of an existing investment.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public Investment update(Investment investment) {
        InvestmentEntity existing = repository.findById(investment.getId())
            .orElseThrow(() -> NotFoundException.of("Investment", investment.getId()));
        existing.updateFromDomain(investment);
        InvestmentEntity updated = repository.save(existing);
        log.debug("Updated investment {} to {}", updated.getId(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Investment> findById(UUID investmentId) {
        return repository.findById(investmentId).map(InvestmentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<Investment> findForUser(UUID investmentId, UUID userId) {
        return repository.findByIdAndUserId(investmentId, userId).map(InvestmentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<Investment> findByUser(UUID userId, InvestmentStatus status) {
        List<InvestmentEntity> entities = status == null
            ? repository.findByUserIdOrderByCreatedAtDesc(userId)
            : repository.findByUserIdAndStatusOrderByCreatedAtDesc(userId, status);
        return entities.stream().map(InvestmentEntity::toDomain).toList();
    }

    @Transactional(readOnly = true)
    public List<Investment> findWithdrawable(UUID userId) {
        return repository.findUnlinkedByStatus(userId, InvestmentStatus.COMPLETED).stream()
            .map(InvestmentEntity::toDomain)
            .toList();
    }

    /**
     * Locks the user's completed investments that no withdrawal has claimed yet.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public List<Investment> lockWithdrawable(UUID userId) {
        return repository.findUnlinkedByStatusForUpdate(userId, InvestmentStatus.COMPLETED).stream()
            .map(this::refreshed)
            .toList();
    }

    /**
     * Guarded link: only investments without a withdrawal are updated.
     *
     * @return number of investments linked
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public int linkToWithdrawal(UUID withdrawalId, List<UUID> investmentIds) {
        return repository.linkToWithdrawal(withdrawalId, investmentIds);
    }

    private Investment refreshed(InvestmentEntity entity) {
        entityManager.refresh(entity);
        return entity.toDomain();
    }

    @Transactional
    public int deleteCancelled(UUID userId) {
        return repository.deleteByUserIdAndStatus(userId, InvestmentStatus.CANCELLED);
    }
}
