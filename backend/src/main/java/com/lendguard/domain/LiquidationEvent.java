package com.lendguard.domain;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Record of a submitted liquidation. Immutable once recorded: no setters, built once by LiquidationLedger.
 */
@Document(collection = "liquidation_events")
@Builder
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@NoArgsConstructor(access = AccessLevel.PRIVATE)
@Getter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class LiquidationEvent {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    @Indexed
    private String positionId;
    private String poolAddress;
    private String liquidatorAddress;
    private BigDecimal collateralSeized;
    private BigDecimal debtRepaid;
    private BigDecimal bonusAmount;
    private BigDecimal collateralPrice;
    private BigDecimal debtPrice;
    @Indexed(unique = true)
    private String transactionHash;
    private Instant executedAt;
}
