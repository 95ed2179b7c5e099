package com.myinfra.gateway.frappegateway.config;

import lombok.RequiredArgsConstructor;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.cors.CorsConfiguration;
import org.springframework.web.cors.reactive.CorsWebFilter;
import org.springframework.web.cors.reactive.UrlBasedCorsConfigurationSource;

import java.util.Arrays;
import java.util.Collections;

@Configuration
@RequiredArgsConstructor
public class CorsConfig {

    private final AppConfig appConfig;

    /**
     * Configures CORS settings for the gateway's REST surface.
     *
     * @return CorsWebFilter with defined CORS configuration
     */
    @Bean
    public CorsWebFilter corsWebFilter() {
        UrlBasedCorsConfigurationSource source = new UrlBasedCorsConfigurationSource();
        source.registerCorsConfiguration("/api/**", corsConfiguration());
        return new CorsWebFilter(source);
    }

    CorsConfiguration corsConfiguration() {
        AppConfig.AuthConfig auth = appConfig.getAuth();
        String delegated = auth.getDelegatedHeaderPrefix();

        CorsConfiguration corsConfig = new CorsConfiguration();

        corsConfig.setAllowedOriginPatterns(Collections.singletonList("*"));

        corsConfig.setAllowedMethods(Arrays.asList("GET", "POST", "PUT", "DELETE", "OPTIONS"));

        corsConfig.setAllowedHeaders(Arrays.asList(
                "Authorization",
                "Content-Type",
                auth.getCsrfHeader(),
                delegated + "ID",
                delegated + "Email",
                delegated + "Name",
                "Accept",
                "Origin",
                "X-Requested-With"
        ));

        // session cookie must reach the gateway
        corsConfig.setAllowCredentials(true);

        corsConfig.setMaxAge(3600L);

        return corsConfig;
    }
}
