package com.flagship.investment_ledger.investment.update;

import com.flagship.investment_ledger.investment.InvestmentRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.UUID;

/**
 * Investment timeline. Written by the event consumer, read by the investment API.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class InvestmentUpdateService {

    private final InvestmentUpdateRepository repository;
    private final InvestmentRepository investmentRepository;

    /**
     * Appends a timeline entry. Investments that were purged in the meantime are skipped.
     *
     * @return true if the entry was written
     */
    @Transactional
    public boolean record(UUID investmentId, UpdateType type, String title, String message) {
        if (!investmentRepository.existsById(investmentId)) {
            log.info("Skipping {} update for missing investment {}", type, investmentId);
            return false;
        }
        repository.save(InvestmentUpdateEntity.fromDomain(
            InvestmentUpdate.create(investmentId, type, title, message)));
        log.debug("Recorded {} update for investment {}", type, investmentId);
        return true;
    }

    @Transactional(readOnly = true)
    public List<InvestmentUpdate> timeline(UUID investmentId) {
        return repository.findByInvestmentIdOrderByCreatedAtAsc(investmentId).stream()
            .map(InvestmentUpdateEntity::toDomain)
            .toList();
    }
}
