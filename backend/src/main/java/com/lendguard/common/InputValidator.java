package com.lendguard.common;

import java.math.BigDecimal;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Boundary checks for amounts, Starknet addresses and transaction hashes. Failures are VALIDATION errors.
 */
public final class InputValidator {

    private static final Pattern STARKNET_FELT_HEX = Pattern.compile("^0x[0-9a-fA-F]{1,64}$");
    private static final BigDecimal MAX_AMOUNT = new BigDecimal("1e36");

    private InputValidator() {}

    /**
     * Parses a decimal string amount that must be strictly positive and at most 1e36.
     */
    public static BigDecimal parsePositiveAmount(String raw, String field) {
        if (raw == null || raw.isBlank()) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " is required", Map.of("field", field));
        }
        BigDecimal value;
        try {
            value = new BigDecimal(raw.strip());
        } catch (NumberFormatException e) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " must be a valid number",
                    Map.of("field", field, "amount", raw), e);
        }
        return requirePositive(value, field);
    }

    public static BigDecimal requirePositive(BigDecimal value, String field) {
        if (value == null || value.signum() <= 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " must be greater than zero",
                    Map.of("field", field, "amount", String.valueOf(value)));
        }
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " exceeds maximum allowed value",
                    Map.of("field", field, "amount", value.toPlainString()));
        }
        return value;
    }

    public static BigDecimal requireNonNegative(BigDecimal value, String field) {
        if (value == null || value.signum() < 0) {
            throw new RiskEngineException(ErrorCode.INVALID_AMOUNT, field + " must be non-negative",
                    Map.of("field", field, "amount", String.valueOf(value)));
        }
        return value;
    }

    public static String requireAddress(String address, String field) {
        if (address == null || !STARKNET_FELT_HEX.matcher(address.strip()).matches()) {
            throw new RiskEngineException(ErrorCode.INVALID_ADDRESS, field + " has invalid format",
                    Map.of("field", field, "address", String.valueOf(address)));
        }
        return address.strip();
    }

    public static boolean isAddress(String address) {
        return address != null && STARKNET_FELT_HEX.matcher(address.strip()).matches();
    }
}
