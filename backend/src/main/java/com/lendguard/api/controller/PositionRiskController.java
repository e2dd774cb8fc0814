package com.lendguard.api.controller;

import com.lendguard.api.dto.AmountRequest;
import com.lendguard.api.dto.PositionHealthResponse;
import com.lendguard.api.dto.SafetyCheckResponse;
import com.lendguard.common.InputValidator;
import com.lendguard.risk.PositionRiskService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Position health and pre-operation safety checks.
 */
@RestController
@RequestMapping("/api/v1/risk/positions")
@RequiredArgsConstructor
public class PositionRiskController {

    private final PositionRiskService positionRiskService;

    @GetMapping("/{positionId}")
    public Mono<PositionHealthResponse> getHealth(@PathVariable String positionId) {
        return Blocking.call(() -> PositionHealthResponse.from(positionRiskService.evaluate(positionId)));
    }

    @PostMapping("/{positionId}/borrow-check")
    public Mono<SafetyCheckResponse> checkBorrow(@PathVariable String positionId,
                                                 @RequestBody @Valid AmountRequest request) {
        BigDecimal amount = InputValidator.parsePositiveAmount(request.amount(), "amount");
        return Blocking.call(() -> SafetyCheckResponse.of("BORROW", amount,
                positionRiskService.checkBorrow(positionId, amount)));
    }

    @PostMapping("/{positionId}/withdraw-check")
    public Mono<SafetyCheckResponse> checkWithdraw(@PathVariable String positionId,
                                                   @RequestBody @Valid AmountRequest request) {
        BigDecimal amount = InputValidator.parsePositiveAmount(request.amount(), "amount");
        return Blocking.call(() -> SafetyCheckResponse.of("WITHDRAW", amount,
                positionRiskService.checkWithdraw(positionId, amount)));
    }
}
