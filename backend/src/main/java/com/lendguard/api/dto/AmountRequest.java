package com.lendguard.api.dto;

import jakarta.validation.constraints.NotBlank;

/**
 * Body of borrow-check and withdraw-check. Amount is a decimal string in asset units.
 */
public record AmountRequest(@NotBlank(message = "INVALID_AMOUNT") String amount) {
}
