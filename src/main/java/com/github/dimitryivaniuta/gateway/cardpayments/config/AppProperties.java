package com.github.dimitryivaniuta.gateway.cardpayments.config;

import java.time.Duration;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application-level configuration properties.
 *
 * <p>The gateway credential is not bound here; {@link GatewayConfig} resolves it from
 * {@code PAYMENT_GATEWAY_API_KEY} into a
 * {@link com.github.dimitryivaniuta.gateway.cardpayments.gateway.GatewayCredentials} bean.</p>
 */
@ConfigurationProperties(prefix = "app")
@Getter
@Setter
public class AppProperties {

    private final Gateway gateway = new Gateway();

    @Getter
    @Setter
    public static class Gateway {
        /**
         * Which gateway implementation authorizes payments.
         */
        private Mode mode = Mode.SIMULATED;

        /**
         * Base URL of the external authorization service (used in {@link Mode#HTTP} only).
         */
        private String baseUrl = "http://localhost:8081";

        /**
         * Client-side timeout for a single authorization call (connect and read).
         */
        private Duration timeout = Duration.ofSeconds(10);
    }

    /**
     * Gateway implementation selector.
     */
    public enum Mode {
        /** Deterministic in-process decision, no network. */
        SIMULATED,

        /** Outbound HTTP call to {@code base-url}. */
        HTTP
    }
}
