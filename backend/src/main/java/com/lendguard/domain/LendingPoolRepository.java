package com.lendguard.domain;

import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for lending_pools. Written by PoolRegistry on chain refresh.
 */
public interface LendingPoolRepository extends MongoRepository<LendingPool, String> {

    Optional<LendingPool> findByPoolAddress(String poolAddress);

    List<LendingPool> findByActiveTrue();
}
