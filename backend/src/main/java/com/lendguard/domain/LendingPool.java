package com.lendguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Collateral/debt pair configuration plus liquidity totals synced from chain.
 * liquidationThreshold >= maxLtv and totalBorrowed <= totalSupplied.
 */
@Document(collection = "lending_pools")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LendingPool {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed(unique = true)
    private String poolAddress;
    private String poolKey;
    private String collateralAsset;
    private String debtAsset;
    private String vaultAddress;
    private BigDecimal maxLtv;
    private BigDecimal liquidationThreshold;
    private BigDecimal liquidationBonus;
    private BigDecimal totalSupplied = BigDecimal.ZERO;
    private BigDecimal totalBorrowed = BigDecimal.ZERO;
    private boolean active;
    private Instant lastSyncedAt;

    /**
     * supplied - borrowed, never negative.
     */
    public BigDecimal availableLiquidity() {
        BigDecimal supplied = totalSupplied != null ? totalSupplied : BigDecimal.ZERO;
        BigDecimal borrowed = totalBorrowed != null ? totalBorrowed : BigDecimal.ZERO;
        BigDecimal available = supplied.subtract(borrowed);
        return available.signum() < 0 ? BigDecimal.ZERO : available;
    }
}
