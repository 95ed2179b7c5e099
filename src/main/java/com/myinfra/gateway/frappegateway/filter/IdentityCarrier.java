package com.myinfra.gateway.frappegateway.filter;

import com.myinfra.gateway.frappegateway.model.Identity;
import org.springframework.web.server.ServerWebExchange;

import java.util.Optional;

/**
 * Carries the resolved {@link Identity} alongside one exchange. The identity lives in the
 * exchange attributes only; handlers read it here and pass it on explicitly.
 */
public final class IdentityCarrier {

    static final String IDENTITY_ATTRIBUTE = IdentityCarrier.class.getName() + ".identity";

    private IdentityCarrier() {
    }

    public static void attach(ServerWebExchange exchange, Identity identity) {
        exchange.getAttributes().put(IDENTITY_ATTRIBUTE, identity);
    }

    public static Optional<Identity> current(ServerWebExchange exchange) {
        return Optional.ofNullable(exchange.getAttribute(IDENTITY_ATTRIBUTE));
    }
}
