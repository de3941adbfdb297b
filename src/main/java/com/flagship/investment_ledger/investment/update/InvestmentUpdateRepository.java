package com.flagship.investment_ledger.investment.update;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface InvestmentUpdateRepository extends JpaRepository<InvestmentUpdateEntity, UUID> {

    List<InvestmentUpdateEntity> findByInvestmentIdOrderByCreatedAtAsc(UUID investmentId);
}
