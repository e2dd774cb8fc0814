package com.lendguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for position_alerts.
 */
public interface PositionAlertRepository extends MongoRepository<PositionAlert, String> {

    List<PositionAlert> findByPositionIdOrderByCreatedAtDesc(String positionId);
}
