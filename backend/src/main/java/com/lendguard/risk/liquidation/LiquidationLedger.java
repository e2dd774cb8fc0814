package com.lendguard.risk.liquidation;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.InputValidator;
import com.lendguard.common.RiskEngineException;
import com.lendguard.domain.LiquidationEvent;
import com.lendguard.domain.LiquidationEventRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Records liquidations reported by the external executor. Recording the same transaction twice returns the
 * stored event.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class LiquidationLedger {

    private final LiquidationEventRepository eventRepository;
    private final Clock clock;

    public LiquidationEvent record(LiquidationProposal proposal, String liquidatorAddress, String transactionHash) {
        String liquidator = InputValidator.requireAddress(liquidatorAddress, "liquidatorAddress");
        if (!InputValidator.isAddress(transactionHash)) {
            throw new RiskEngineException(ErrorCode.INVALID_TRANSACTION_HASH, "transactionHash has invalid format",
                    Map.of("transactionHash", String.valueOf(transactionHash)));
        }
        String txHash = transactionHash.strip().toLowerCase(Locale.ROOT);
        Optional<LiquidationEvent> existing = eventRepository.findByTransactionHash(txHash);
        if (existing.isPresent()) {
            log.info("Liquidation {} already recorded", txHash);
            return existing.get();
        }
        LiquidationEvent event = LiquidationEvent.builder()
                .positionId(proposal.positionId())
                .poolAddress(proposal.poolAddress())
                .liquidatorAddress(liquidator)
                .collateralSeized(proposal.collateralToSeize())
                .debtRepaid(proposal.debtToCover())
                .bonusAmount(proposal.bonusCollateral())
                .collateralPrice(proposal.collateralPrice())
                .debtPrice(proposal.debtPrice())
                .transactionHash(txHash)
                .executedAt(clock.instant())
                .build();
        try {
            LiquidationEvent saved = eventRepository.save(event);
            log.info("Recorded liquidation of position {} (tx {}, debt repaid {})",
                    proposal.positionId(), txHash, proposal.debtToCover().toPlainString());
            return saved;
        } catch (DataAccessException e) {
            throw new RiskEngineException(ErrorCode.PERSISTENCE_FAILED,
                    "Failed to record liquidation " + txHash, Map.of("transactionHash", txHash), e);
        }
    }

    public List<LiquidationEvent> history(String positionId) {
        return eventRepository.findByPositionIdOrderByExecutedAtDesc(positionId);
    }
}
