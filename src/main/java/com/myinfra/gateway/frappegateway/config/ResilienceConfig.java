package com.myinfra.gateway.frappegateway.config;

import com.myinfra.gateway.frappegateway.exception.GatewayException;
import com.myinfra.gateway.frappegateway.exception.RetryExhaustedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.timelimiter.TimeLimiterConfig;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cloud.circuitbreaker.resilience4j.ReactiveResilience4JCircuitBreakerFactory;
import org.springframework.cloud.client.circuitbreaker.Customizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Slf4j
@Configuration
@RequiredArgsConstructor
public class ResilienceConfig {

    public static final String UPSTREAM_CIRCUIT_BREAKER = "frappe";

    private final AppConfig appConfig;

    /**
     * Configures the circuit breaker guarding the Frappe upstream from the settings in AppConfig.
     *
     * @return Customizer for ReactiveResilience4JCircuitBreakerFactory
     */
    @Bean
    public Customizer<ReactiveResilience4JCircuitBreakerFactory> upstreamCustomizer() {
        return factory -> factory.configure(builder -> builder
                        .circuitBreakerConfig(upstreamCircuitBreakerConfig())
                        // the client enforces its own call timeout
                        .timeLimiterConfig(TimeLimiterConfig.custom().timeoutDuration(Duration.ofDays(1)).build()),
                UPSTREAM_CIRCUIT_BREAKER);
    }

    /**
     * Only outcomes a retry could have fixed count as failures: transport errors, 5xx
     * answers and exhausted retries. Rejections (4xx), missing credentials and local
     * configuration errors leave the breaker alone.
     */
    CircuitBreakerConfig upstreamCircuitBreakerConfig() {
        AppConfig.CircuitBreakerConfig myConfig = appConfig.getUpstream().getCircuitBreaker();

        log.debug("Configuring Circuit Breaker for '{}': failureRate={}%, wait={}s", UPSTREAM_CIRCUIT_BREAKER,
                myConfig.getFailureRateThreshold(), myConfig.getWaitDuration().getSeconds());

        return CircuitBreakerConfig.custom()
                .slidingWindowType(CircuitBreakerConfig.SlidingWindowType.COUNT_BASED)
                .slidingWindowSize(myConfig.getSlidingWindowSize())
                .minimumNumberOfCalls(myConfig.getMinimumNumberOfCalls())
                .failureRateThreshold(myConfig.getFailureRateThreshold())
                .waitDurationInOpenState(myConfig.getWaitDuration())
                .permittedNumberOfCallsInHalfOpenState(myConfig.getPermittedNumberOfCallsInHalfOpenState())
                .recordException(ResilienceConfig::isUpstreamFailure)
                .build();
    }

    static boolean isUpstreamFailure(Throwable throwable) {
        if (throwable instanceof GatewayException gatewayException) {
            return gatewayException.isRetryable() || gatewayException instanceof RetryExhaustedException;
        }
        return false;
    }
}
