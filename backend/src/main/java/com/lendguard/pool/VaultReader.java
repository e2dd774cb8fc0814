package com.lendguard.pool;

import java.math.BigDecimal;

/**
 * Typed read access to share vaults (vTokens).
 */
public interface VaultReader {

    /**
     * Assets per share: total assets / total supply, or 1 when the vault has no shares yet.
     */
    BigDecimal readVaultExchangeRate(String vaultAddress);
}
