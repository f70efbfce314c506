package com.github.dimitryivaniuta.gateway.cardpayments.config;

import com.github.dimitryivaniuta.gateway.cardpayments.gateway.GatewayCredentials;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.HttpPaymentGatewayClient;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.PaymentGatewayClient;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.SimulatedPaymentGatewayClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.web.client.RestClient;

/**
 * Gateway wiring: credential and client implementation.
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    /**
     * Gateway credential.
     *
     * <p>{@code app.gateway.api-key} points at {@code ${PAYMENT_GATEWAY_API_KEY}}; {@code @Value} resolution is
     * strict, so an unset variable aborts startup. A variable set to an empty string is accepted here and
     * rejected on every request.</p>
     *
     * @param apiKey resolved key
     * @return credentials
     */
    @Bean
    public GatewayCredentials gatewayCredentials(@Value("${app.gateway.api-key}") String apiKey) {
        GatewayCredentials credentials = new GatewayCredentials(apiKey);
        if (credentials.isMissing()) {
            log.warn("Gateway API key is empty; every payment request will fail until it is configured");
        }
        return credentials;
    }

    /**
     * Gateway client selected by {@code app.gateway.mode}.
     *
     * @param properties app properties
     * @param restClientBuilder builder provided by Spring Boot
     * @return gateway client
     */
    @Bean
    public PaymentGatewayClient paymentGatewayClient(AppProperties properties, RestClient.Builder restClientBuilder) {
        AppProperties.Gateway gateway = properties.getGateway();
        return switch (gateway.getMode()) {
            case SIMULATED -> {
                log.info("Using simulated payment gateway");
                yield new SimulatedPaymentGatewayClient();
            }
            case HTTP -> {
                SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
                requestFactory.setConnectTimeout(gateway.getTimeout());
                requestFactory.setReadTimeout(gateway.getTimeout());

                log.info("Using HTTP payment gateway baseUrl={} timeout={}", gateway.getBaseUrl(), gateway.getTimeout());
                yield new HttpPaymentGatewayClient(restClientBuilder
                        .baseUrl(gateway.getBaseUrl())
                        .requestFactory(requestFactory)
                        .build());
            }
        };
    }
}
