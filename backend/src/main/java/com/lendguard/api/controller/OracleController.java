package com.lendguard.api.controller;

import com.lendguard.api.dto.ErrorBody;
import com.lendguard.api.dto.PriceBatchResponse;
import com.lendguard.api.dto.PriceQuoteResponse;
import com.lendguard.pricing.OracleHealth;
import com.lendguard.pricing.PriceOracleClient;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.Arrays;
import java.util.List;

/**
 * Oracle prices, health probe and cache control.
 */
@RestController
@RequestMapping("/api/v1/risk/oracle")
@RequiredArgsConstructor
public class OracleController {

    private final PriceOracleClient priceOracleClient;

    @GetMapping("/prices/{asset}")
    public Mono<PriceQuoteResponse> price(@PathVariable String asset,
                                          @RequestParam(defaultValue = "false") boolean bypassCache) {
        return Blocking.call(() -> PriceQuoteResponse.from(priceOracleClient.getPrice(asset, bypassCache)));
    }

    @GetMapping("/prices")
    public Mono<ResponseEntity<?>> prices(@RequestParam String assets) {
        List<String> symbols = Arrays.stream(assets.split(","))
                .map(String::strip)
                .filter(s -> !s.isEmpty())
                .distinct()
                .toList();
        if (symbols.isEmpty()) {
            return Mono.just(ResponseEntity.badRequest().body(ErrorBody.of("UNSUPPORTED_ASSET", "assets is required")));
        }
        return Blocking.call(() -> ResponseEntity.ok(PriceBatchResponse.from(priceOracleClient.getPrices(symbols))));
    }

    @GetMapping("/health")
    public Mono<ResponseEntity<OracleHealth>> health(@RequestParam(required = false) String asset) {
        return Blocking.call(() -> {
            OracleHealth health = priceOracleClient.healthCheck(asset);
            HttpStatus status = health.healthy() ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE;
            return ResponseEntity.status(status).body(health);
        });
    }

    @PostMapping("/cache/clear")
    public ResponseEntity<Void> clearCache() {
        priceOracleClient.clearCache();
        return ResponseEntity.noContent().build();
    }
}
