package com.flagship.investment_ledger.investment.update;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

@Entity
@Table(name = "investment_updates")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class InvestmentUpdateEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Column(name = "investment_id", nullable = false, updatable = false)
    private UUID investmentId;

    @Enumerated(EnumType.STRING)
    @Column(name = "update_type", nullable = false, updatable = false, length = 40)
    private UpdateType updateType;

    @Column(nullable = false, updatable = false, length = 200)
    private String title;

    @Column(columnDefinition = "TEXT", updatable = false)
    private String message;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    static InvestmentUpdateEntity fromDomain(InvestmentUpdate update) {
        return new InvestmentUpdateEntity(
            update.getId(),
            update.getInvestmentId(),
            update.getType(),
            update.getTitle(),
            update.getMessage(),
            update.getCreatedAt()
        );
    }

    public InvestmentUpdate toDomain() {
        return new InvestmentUpdate(id, investmentId, updateType, title, message, createdAt);
    }
}
