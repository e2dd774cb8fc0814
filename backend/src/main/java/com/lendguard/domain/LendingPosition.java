package com.lendguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * A user's exposure in one pool. Principal amounts are owned by the lending flows; the risk engine only
 * rewrites healthFactor and lastHealthCheckAt. healthFactor null means no debt (infinitely healthy).
 */
@Document(collection = "lending_positions")
@CompoundIndex(name = "user_pool", def = "{'userId': 1, 'poolAddress': 1}", unique = true)
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LendingPosition {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String userId;
    private String poolAddress;
    private String collateralAsset;
    private BigDecimal collateralAmount = BigDecimal.ZERO;
    private String debtAsset;
    private BigDecimal debtAmount = BigDecimal.ZERO;
    /** Vault share (vToken) balance backing the supplied collateral. */
    private BigDecimal vtokenBalance = BigDecimal.ZERO;
    private BigDecimal healthFactor;
    private Instant lastHealthCheckAt;
    @Indexed
    private PositionStatus status = PositionStatus.ACTIVE;
    private Instant createdAt;
    private Instant updatedAt;

    public boolean hasDebt() {
        return debtAmount != null && debtAmount.signum() > 0;
    }

    public boolean isActive() {
        return status == PositionStatus.ACTIVE;
    }

    public BigDecimal collateralOrZero() {
        return collateralAmount != null ? collateralAmount : BigDecimal.ZERO;
    }

    public BigDecimal debtOrZero() {
        return debtAmount != null ? debtAmount : BigDecimal.ZERO;
    }
}
