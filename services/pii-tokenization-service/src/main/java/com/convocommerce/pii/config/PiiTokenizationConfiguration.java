package com.convocommerce.pii.config;

import com.convocommerce.pii.domain.PaymentFieldPolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
@EnableConfigurationProperties(PiiTokenizationProperties.class)
public class PiiTokenizationConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }

    @Bean
    public PaymentFieldPolicy paymentFieldPolicy(PiiTokenizationProperties properties) {
        return PaymentFieldPolicy.of(
                properties.getPayment().getCriticalFields(),
                properties.getPayment().getNonCriticalFields());
    }
}
