package com.myinfra.gateway.frappegateway.support;

import com.myinfra.gateway.frappegateway.config.AppConfig;
import com.myinfra.gateway.frappegateway.config.ResilienceConfig;
import io.github.resilience4j.circuitbreaker.CircuitBreakerRegistry;
import io.github.resilience4j.timelimiter.TimeLimiterRegistry;
import org.springframework.cloud.circuitbreaker.resilience4j.ReactiveResilience4JCircuitBreakerFactory;
import org.springframework.cloud.circuitbreaker.resilience4j.Resilience4JConfigurationProperties;

/**
 * Circuit breaker factories wired the way the application context wires them.
 */
public final class CircuitBreakers {

    private CircuitBreakers() {
    }

    public static ReactiveResilience4JCircuitBreakerFactory factory(AppConfig appConfig) {
        ReactiveResilience4JCircuitBreakerFactory factory = new ReactiveResilience4JCircuitBreakerFactory(
                CircuitBreakerRegistry.ofDefaults(), TimeLimiterRegistry.ofDefaults(),
                new Resilience4JConfigurationProperties());
        new ResilienceConfig(appConfig).upstreamCustomizer().customize(factory);
        return factory;
    }
}
