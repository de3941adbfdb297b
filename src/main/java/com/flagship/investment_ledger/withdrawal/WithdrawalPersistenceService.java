package com.flagship.investment_ledger.withdrawal;

import jakarta.persistence.EntityManager;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Bridges {@link WithdrawalRequest} and its JPA entity.
 */
@Service
@RequiredArgsConstructor
public class WithdrawalPersistenceService {

    private final WithdrawalRequestRepository repository;
    private final EntityManager entityManager;

    /**
     * Flushes immediately so the row exists before investments reference it.
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public WithdrawalRequest create(WithdrawalRequest request) {
        return repository.saveAndFlush(WithdrawalRequestEntity.fromDomain(request)).toDomain();
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public Optional<WithdrawalRequest> lock(UUID withdrawalId) {
        return repository.findByIdForUpdate(withdrawalId).map(entity -> {
            entityManager.refresh(entity);
            return entity.toDomain();
        });
    }

    @Transactional(propagation = Propagation.MANDATORY)
    public WithdrawalRequest update(WithdrawalRequest request) {
        WithdrawalRequestEntity entity = repository.findById(request.getId())
            .orElseThrow(() -> new IllegalStateException("Withdrawal request disappeared: " + request.getId()));
        entity.updateFromDomain(request);
        return repository.save(entity).toDomain();
    }

    @Transactional(readOnly = true)
    public Optional<WithdrawalRequest> findById(UUID withdrawalId) {
        return repository.findById(withdrawalId).map(WithdrawalRequestEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public Optional<WithdrawalRequest> findForUser(UUID withdrawalId, UUID userId) {
        return repository.findByIdAndUserId(withdrawalId, userId).map(WithdrawalRequestEntity::toDomain);
    }

    @Transactional(readOnly = true)
    public List<WithdrawalRequest> findByUser(UUID userId) {
        return repository.findByUserIdOrderByCreatedAtDesc(userId).stream()
            .map(WithdrawalRequestEntity::toDomain)
            .toList();
    }
}
