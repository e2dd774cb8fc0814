package com.lendguard.api.controller;

import com.lendguard.common.ErrorCode;
import com.lendguard.common.RiskEngineException;
import com.lendguard.pricing.AggregationMode;
import com.lendguard.pricing.OracleHealth;
import com.lendguard.pricing.PriceBatchResult;
import com.lendguard.pricing.PriceOracleClient;
import com.lendguard.pricing.PriceQuote;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(OracleController.class)
class OracleControllerTest {

    private static final Instant UPDATED = Instant.parse("2025-03-01T11:59:50Z");

    @Autowired
    WebTestClient webTestClient;

    @MockBean
    PriceOracleClient priceOracleClient;

    @Test
    @DisplayName("single price honours bypassCache")
    void singlePrice() {
        when(priceOracleClient.getPrice("ETH", true)).thenReturn(quote("ETH", "2500"));

        webTestClient.get().uri("/api/v1/risk/oracle/prices/ETH?bypassCache=true")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.asset").isEqualTo("ETH")
                .jsonPath("$.price").isEqualTo(2500)
                .jsonPath("$.mode").isEqualTo("MEDIAN")
                .jsonPath("$.cached").isEqualTo(false);
    }

    @Test
    @DisplayName("unsupported asset is 400")
    void unsupportedAsset() {
        when(priceOracleClient.getPrice("DOGE", false))
                .thenThrow(new RiskEngineException(ErrorCode.UNSUPPORTED_ASSET, "Unsupported asset: DOGE"));

        webTestClient.get().uri("/api/v1/risk/oracle/prices/DOGE")
                .exchange()
                .expectStatus().isBadRequest()
                .expectBody()
                .jsonPath("$.error").isEqualTo("UNSUPPORTED_ASSET");
    }

    @Test
    @DisplayName("batch returns resolved prices next to per-asset errors")
    void batchPrices() {
        when(priceOracleClient.getPrices(List.of("ETH", "STRK"))).thenReturn(new PriceBatchResult(
                Map.of("ETH", quote("ETH", "2500")),
                Map.of("STRK", new RiskEngineException(ErrorCode.STALE_PRICE, "Price for STRK is stale"))));

        webTestClient.get().uri("/api/v1/risk/oracle/prices?assets=ETH,STRK,ETH")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.prices.ETH.price").isEqualTo(2500)
                .jsonPath("$.errors.STRK.error").isEqualTo("STALE_PRICE")
                .jsonPath("$.errors.STRK.retryable").isEqualTo(true);
    }

    @Test
    @DisplayName("empty asset list is 400")
    void emptyBatch() {
        webTestClient.get().uri("/api/v1/risk/oracle/prices?assets=,,")
                .exchange()
                .expectStatus().isBadRequest();
        verify(priceOracleClient, never()).getPrices(any());
    }

    @Test
    @DisplayName("unhealthy oracle is 503 with the failure reason")
    void healthEndpoint() {
        Instant now = Instant.parse("2025-03-01T12:00:00Z");
        when(priceOracleClient.healthCheck("ETH")).thenReturn(
                new OracleHealth(true, "ETH", new BigDecimal("2500"), 5, UPDATED, null, null, now));
        when(priceOracleClient.healthCheck("STRK")).thenReturn(
                new OracleHealth(false, "STRK", null, null, null, "NETWORK_TIMEOUT", "timed out", now));

        webTestClient.get().uri("/api/v1/risk/oracle/health?asset=ETH")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.healthy").isEqualTo(true);
        webTestClient.get().uri("/api/v1/risk/oracle/health?asset=STRK")
                .exchange()
                .expectStatus().isEqualTo(503)
                .expectBody()
                .jsonPath("$.error").isEqualTo("NETWORK_TIMEOUT");
    }

    @Test
    @DisplayName("cache clear is 204")
    void clearCache() {
        webTestClient.post().uri("/api/v1/risk/oracle/cache/clear")
                .exchange()
                .expectStatus().isNoContent();
        verify(priceOracleClient).clearCache();
    }

    private static PriceQuote quote(String asset, String price) {
        BigDecimal p = new BigDecimal(price);
        return new PriceQuote(asset, p, p.movePointRight(8).toBigInteger(), 8, UPDATED, 5, null,
                AggregationMode.MEDIAN, false, false);
    }
}
