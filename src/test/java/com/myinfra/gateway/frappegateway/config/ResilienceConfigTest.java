package com.myinfra.gateway.frappegateway.config;

import com.myinfra.gateway.frappegateway.exception.AuthenticationException;
import com.myinfra.gateway.frappegateway.exception.ConfigurationException;
import com.myinfra.gateway.frappegateway.exception.NetworkException;
import com.myinfra.gateway.frappegateway.exception.RetryExhaustedException;
import com.myinfra.gateway.frappegateway.exception.UpstreamException;
import com.myinfra.gateway.frappegateway.support.CircuitBreakers;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import org.junit.jupiter.api.Test;
import org.springframework.cloud.client.circuitbreaker.ReactiveCircuitBreaker;
import reactor.core.publisher.Mono;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResilienceConfigTest {

    @Test
    void onlyUpstreamFailuresAreRecorded() {
        UpstreamException serverError = new UpstreamException("t", 503, "down", null, null);

        assertThat(ResilienceConfig.isUpstreamFailure(serverError)).isTrue();
        assertThat(ResilienceConfig.isUpstreamFailure(new NetworkException("t: refused", new IOException()))).isTrue();
        assertThat(ResilienceConfig.isUpstreamFailure(new RetryExhaustedException("t", 3, serverError))).isTrue();

        assertThat(ResilienceConfig.isUpstreamFailure(new UpstreamException("t", 404, "missing", null, null))).isFalse();
        assertThat(ResilienceConfig.isUpstreamFailure(new AuthenticationException("no credentials"))).isFalse();
        assertThat(ResilienceConfig.isUpstreamFailure(new ConfigurationException("csrf"))).isFalse();
        assertThat(ResilienceConfig.isUpstreamFailure(new IllegalStateException())).isFalse();
    }

    @Test
    void breakerUsesConfiguredThresholds() {
        AppConfig appConfig = new AppConfig();
        appConfig.getUpstream().getCircuitBreaker().setFailureRateThreshold(25f);

        CircuitBreakerConfig config = new ResilienceConfig(appConfig).upstreamCircuitBreakerConfig();

        assertThat(config.getFailureRateThreshold()).isEqualTo(25f);
        assertThat(config.getSlidingWindowSize()).isEqualTo(10);
        assertThat(config.getMinimumNumberOfCalls()).isEqualTo(10);
    }

    @Test
    void clientErrorsDoNotOpenTheBreaker() {
        AppConfig appConfig = new AppConfig();
        appConfig.getUpstream().getCircuitBreaker().setSlidingWindowSize(2);
        appConfig.getUpstream().getCircuitBreaker().setMinimumNumberOfCalls(2);
        ReactiveCircuitBreaker breaker = CircuitBreakers.factory(appConfig)
                .create(ResilienceConfig.UPSTREAM_CIRCUIT_BREAKER);

        for (int i = 0; i < 3; i++) {
            assertThatThrownBy(() -> run(breaker, Mono.error(new UpstreamException("t", 404, "missing", null, null))).block())
                    .isInstanceOf(UpstreamException.class);
        }
        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> run(breaker, Mono.error(new UpstreamException("t", 500, "down", null, null))).block())
                    .isInstanceOf(UpstreamException.class);
        }

        assertThatThrownBy(() -> run(breaker, Mono.just("ok")).block())
                .isInstanceOf(CallNotPermittedException.class);
    }

    private static Mono<String> run(ReactiveCircuitBreaker breaker, Mono<String> call) {
        return breaker.run(call, throwable -> Mono.error(throwable));
    }
}
