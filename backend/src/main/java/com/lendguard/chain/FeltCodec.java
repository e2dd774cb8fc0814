package com.lendguard.chain;

import org.web3j.crypto.Hash;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Starknet felt helpers: entry point selectors, hex/decimal felts, u256 pairs and Cairo Option values.
 */
public final class FeltCodec {

    private static final BigInteger MASK_250 = BigInteger.ONE.shiftLeft(250).subtract(BigInteger.ONE);
    private static final Map<String, String> SELECTORS = new ConcurrentHashMap<>();

    /** Cairo serializes Option as a variant index: 0 = Some(value), 1 = None. */
    public static final int OPTION_SOME = 0;
    public static final int OPTION_NONE = 1;

    private FeltCodec() {}

    /**
     * starknet_keccak(name): Keccak-256 of the ASCII name masked to 250 bits, as 0x-hex.
     */
    public static String selector(String entryPoint) {
        return SELECTORS.computeIfAbsent(entryPoint, name -> {
            byte[] hash = Hash.sha3(name.getBytes(StandardCharsets.US_ASCII));
            return toHex(new BigInteger(1, hash).and(MASK_250));
        });
    }

    /**
     * Parses a felt given as 0x-hex or decimal.
     */
    public static BigInteger parse(String felt) {
        if (felt == null || felt.isBlank()) {
            throw new IllegalArgumentException("felt is empty");
        }
        String s = felt.strip().toLowerCase(Locale.ROOT);
        BigInteger value = s.startsWith("0x") ? new BigInteger(s.substring(2), 16) : new BigInteger(s);
        if (value.signum() < 0) {
            throw new IllegalArgumentException("felt cannot be negative: " + felt);
        }
        return value;
    }

    public static String toHex(BigInteger value) {
        return "0x" + value.toString(16);
    }

    public static String toHex(long value) {
        return toHex(BigInteger.valueOf(value));
    }

    /**
     * u256 from its (low, high) 128-bit felts.
     */
    public static BigInteger u256(BigInteger low, BigInteger high) {
        return high.shiftLeft(128).or(low);
    }

    /**
     * u256 starting at {@code offset} in a call result.
     */
    public static BigInteger u256(List<BigInteger> result, int offset) {
        if (result.size() < offset + 2) {
            throw new RpcException("Expected u256 at offset " + offset + ", result has " + result.size() + " felts");
        }
        return u256(result.get(offset), result.get(offset + 1));
    }

    /**
     * Option&lt;felt&gt; starting at {@code offset}; null for None.
     */
    public static BigInteger option(List<BigInteger> result, int offset) {
        if (result.size() <= offset) {
            return null;
        }
        int tag = result.get(offset).intValueExact();
        if (tag == OPTION_NONE) {
            return null;
        }
        if (tag != OPTION_SOME || result.size() <= offset + 1) {
            throw new RpcException("Malformed Option at offset " + offset);
        }
        return result.get(offset + 1);
    }
}
