package com.lendguard.pricing;

import java.math.BigInteger;

/**
 * Raw oracle answer: integer price scaled by 10^decimals, unix-second timestamps.
 *
 * @param expiration unix seconds after which the answer must not be used, or null if the feed has none
 */
public record OracleResponse(BigInteger rawPrice, int decimals, long lastUpdated, int numSources, Long expiration) {
}
