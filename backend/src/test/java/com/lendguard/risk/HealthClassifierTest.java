package com.lendguard.risk;

import com.lendguard.domain.AlertPriority;
import com.lendguard.domain.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HealthClassifierTest {

    private final HealthClassifier classifier = HealthClassifier.defaults();

    @Test
    @DisplayName("values on a threshold fall into the safer bucket")
    void boundaries() {
        assertThat(classify("1.2")).isEqualTo(HealthStatus.HEALTHY);
        assertThat(classify("1.19")).isEqualTo(HealthStatus.WARNING);
        assertThat(classify("1.05")).isEqualTo(HealthStatus.WARNING);
        assertThat(classify("1.049")).isEqualTo(HealthStatus.CRITICAL);
        assertThat(classify("1.0")).isEqualTo(HealthStatus.CRITICAL);
        assertThat(classify("0.99")).isEqualTo(HealthStatus.LIQUIDATABLE);
    }

    @Test
    @DisplayName("infinite health factor is HEALTHY")
    void infiniteIsHealthy() {
        assertThat(classifier.classify(HealthFactor.INFINITE)).isEqualTo(HealthStatus.HEALTHY);
    }

    @Test
    @DisplayName("threshold and priority per status")
    void thresholdsAndPriorities() {
        assertThat(classifier.thresholdFor(HealthStatus.WARNING)).isEqualByComparingTo("1.2");
        assertThat(classifier.thresholdFor(HealthStatus.CRITICAL)).isEqualByComparingTo("1.05");
        assertThat(classifier.thresholdFor(HealthStatus.LIQUIDATABLE)).isEqualByComparingTo("1");
        assertThat(classifier.thresholdFor(HealthStatus.HEALTHY)).isNull();

        assertThat(HealthClassifier.priorityFor(HealthStatus.WARNING)).isEqualTo(AlertPriority.MEDIUM);
        assertThat(HealthClassifier.priorityFor(HealthStatus.CRITICAL)).isEqualTo(AlertPriority.CRITICAL);
        assertThat(HealthClassifier.priorityFor(HealthStatus.LIQUIDATABLE)).isEqualTo(AlertPriority.CRITICAL);
    }

    @Test
    @DisplayName("thresholds out of order are rejected")
    void invalidOrdering() {
        assertThatThrownBy(() -> new HealthClassifier(new BigDecimal("1.05"), new BigDecimal("1.2"), BigDecimal.ONE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private HealthStatus classify(String hf) {
        return classifier.classify(HealthFactor.of(new BigDecimal(hf)));
    }
}
