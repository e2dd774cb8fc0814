package com.lendguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

/**
 * Persistence for lending_positions. Read by the monitor and the liquidation scanner.
 */
public interface LendingPositionRepository extends MongoRepository<LendingPosition, String>, LendingPositionRepositoryCustom {

    List<LendingPosition> findByStatus(PositionStatus status);

    List<LendingPosition> findByPoolAddressAndStatus(String poolAddress, PositionStatus status);
}
