package com.flagship.investment_ledger.payment;

import com.flagship.investment_ledger.exception.NotFoundException;
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
 * Bridges the Payment domain object and its JPA entity.
 * Locking reads require an active transaction and reload the row after locking it.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class PaymentPersistenceService {

    private final PaymentRepository paymentRepository;
    private final EntityManager entityManager;

    @Transactional
    public Payment save(Payment payment) {
        PaymentEntity saved = paymentRepository.save(PaymentEntity.fromDomain(payment));
        log.debug("Saved payment {} with reference {}", saved.getId(), saved.getReference());
        return saved.toDomain();
    }

    /**
     * Writes the mutable fields of an existing payment.
     */
    @Transactional
    public Payment update(Payment payment) {
        PaymentEntity existing = paymentRepository.findById(payment.getId())
            .orElseThrow(() -> NotFoundException.of("Payment", payment.getId()));

        existing.updateFromDomain(payment);

        PaymentEntity updated = paymentRepository.save(existing);
        log.debug("Updated payment {} to {}", updated.getReference(), updated.getStatus());
        return updated.toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findByReference(String reference) {
        return paymentRepository.findByReference(reference)
            .map(PaymentEntity::toDomain);
    }

    /**
     * Finds a payment by reference, visible only to its owner.
     */
    @Transactional(readOnly = true)
    public Optional<Payment> findByReferenceForUser(String reference, UUID userId) {
        return paymentRepository.findByReferenceAndUserId(reference, userId)
            .map(PaymentEntity::toDomain);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<Payment> lockByReference(String reference) {
        return paymentRepository.findByReferenceForUpdate(reference)
            .map(this::refreshed);
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public List<Payment> lockForInvestment(UUID investmentId) {
        return paymentRepository.findByInvestmentIdForUpdate(investmentId).stream()
            .map(this::refreshed)
            .toList();
    }

    private Payment refreshed(PaymentEntity entity) {
        entityManager.refresh(entity);
        return entity.toDomain();
    }

    @Transactional(readOnly = true)
    public List<Payment> findForInvestment(UUID investmentId) {
        return paymentRepository.findByInvestmentIdOrderByCreatedAtDesc(investmentId).stream()
            .map(PaymentEntity::toDomain)
            .toList();
    }

    @Transactional(readOnly = true)
    public Optional<Payment> findLatestForInvestment(UUID investmentId) {
        return paymentRepository.findFirstByInvestmentIdOrderByCreatedAtDesc(investmentId)
            .map(PaymentEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public boolean hasSuccessfulPayment(UUID investmentId) {
        return paymentRepository.existsByInvestmentIdAndStatus(investmentId, PaymentStatus.SUCCESS);
    }

    /**
     * True if a payment other than {@code paymentId} already succeeded for the investment.
     */
    @Transactional(readOnly = true)
    public boolean hasOtherSuccessfulPayment(UUID investmentId, UUID paymentId) {
        return paymentRepository.existsByInvestmentIdAndStatusAndIdNot(
            investmentId, PaymentStatus.SUCCESS, paymentId);
    }
}
