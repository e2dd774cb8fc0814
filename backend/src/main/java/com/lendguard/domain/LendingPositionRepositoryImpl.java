package com.lendguard.domain;

import lombok.RequiredArgsConstructor;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.time.Instant;

import static org.springframework.data.mongodb.core.query.Criteria.where;

/**
 * Implementation of LendingPositionRepositoryCustom using MongoTemplate.updateFirst with $set on derived fields only.
 */
@Repository
@RequiredArgsConstructor
public class LendingPositionRepositoryImpl implements LendingPositionRepositoryCustom {

    private final MongoTemplate mongoTemplate;

    @Override
    public boolean updateHealthFactor(String positionId, BigDecimal healthFactor, Instant checkedAt) {
        Query query = new Query(where("_id").is(positionId));
        Update update = new Update()
                .set("healthFactor", healthFactor)
                .set("lastHealthCheckAt", checkedAt);
        return mongoTemplate.updateFirst(query, update, LendingPosition.class).getMatchedCount() > 0;
    }
}
