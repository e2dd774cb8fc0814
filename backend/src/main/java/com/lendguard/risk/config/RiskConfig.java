package com.lendguard.risk.config;

import com.lendguard.common.DecimalContext;
import com.lendguard.risk.HealthClassifier;
import com.lendguard.risk.RiskMath;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.RoundingMode;

/**
 * Risk module configuration: the decimal context, the math functions and the severity classifier.
 */
@Configuration
@EnableConfigurationProperties(RiskProperties.class)
public class RiskConfig {

    @Bean
    public DecimalContext decimalContext(RiskProperties riskProperties) {
        return new DecimalContext(riskProperties.getPrecision(), RoundingMode.HALF_EVEN, riskProperties.getOutputScale());
    }

    @Bean
    public RiskMath riskMath(DecimalContext decimalContext) {
        return new RiskMath(decimalContext);
    }

    @Bean
    public HealthClassifier healthClassifier(RiskProperties riskProperties) {
        RiskProperties.MonitorProperties m = riskProperties.getMonitor();
        return new HealthClassifier(m.getWarningThreshold(), m.getCriticalThreshold(), m.getLiquidationThreshold());
    }
}
