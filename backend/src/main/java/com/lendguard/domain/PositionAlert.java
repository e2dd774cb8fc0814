package com.lendguard.domain;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.math.BigDecimal;
import java.time.Instant;

/**
 * Alert raised by the position monitor when a position enters WARNING, CRITICAL or LIQUIDATABLE.
 */
@Document(collection = "position_alerts")
@CompoundIndex(name = "position_created", def = "{'positionId': 1, 'createdAt': -1}")
@NoArgsConstructor
@Getter
@Setter
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
public class PositionAlert {

    @Id
    @EqualsAndHashCode.Include
    private String id;
    private String positionId;
    private String userId;
    private String poolAddress;
    private String collateralAsset;
    private String debtAsset;
    private BigDecimal healthFactor;
    /** Health-factor threshold that was crossed (e.g. 1.2 for WARNING). */
    private BigDecimal threshold;
    private HealthStatus healthStatus;
    private AlertPriority priority;
    private String title;
    private String message;
    private Instant createdAt;
}
