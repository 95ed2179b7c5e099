package com.myinfra.gateway.frappegateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point of the Frappe gateway: a reactive front for the Frappe document API that
 * resolves the caller's identity and forwards document, search, aggregation and report
 * calls with rate limiting, retry and caching.
 */
@SpringBootApplication
public class FrappeGatewayApplication {

    public static void main(String[] args) {
        SpringApplication.run(FrappeGatewayApplication.class, args);
    }
}
