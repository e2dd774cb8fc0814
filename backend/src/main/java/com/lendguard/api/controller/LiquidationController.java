package com.lendguard.api.controller;

import com.lendguard.api.dto.LiquidationOpportunityResponse;
import com.lendguard.api.dto.LiquidationProposalRequest;
import com.lendguard.api.dto.LiquidationProposalResponse;
import com.lendguard.common.InputValidator;
import com.lendguard.risk.liquidation.LiquidationScanner;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.util.List;

/**
 * Liquidation opportunities and proposals for the external executor. Nothing here submits transactions.
 */
@RestController
@RequestMapping("/api/v1/risk/liquidations")
@RequiredArgsConstructor
public class LiquidationController {

    private final LiquidationScanner liquidationScanner;

    @GetMapping
    public Mono<List<LiquidationOpportunityResponse>> opportunities() {
        return Blocking.call(() -> liquidationScanner.findLiquidatablePositions().stream()
                .map(LiquidationOpportunityResponse::from)
                .toList());
    }

    @PostMapping("/proposals")
    public Mono<LiquidationProposalResponse> propose(@RequestBody @Valid LiquidationProposalRequest request) {
        BigDecimal debtToCover = request.debtToCover() == null || request.debtToCover().isBlank()
                ? null
                : InputValidator.parsePositiveAmount(request.debtToCover(), "debtToCover");
        return Blocking.call(() -> LiquidationProposalResponse.from(
                liquidationScanner.propose(request.positionId().strip(), debtToCover)));
    }
}
