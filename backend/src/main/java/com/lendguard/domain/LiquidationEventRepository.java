package com.lendguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for liquidation_events.
 */
public interface LiquidationEventRepository extends MongoRepository<LiquidationEvent, String> {

    List<LiquidationEvent> findByPositionIdOrderByExecutedAtDesc(String positionId);

    Optional<LiquidationEvent> findByTransactionHash(String transactionHash);
}
