package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.error.EnvironmentException;
import com.github.dimitryivaniuta.gateway.cardpayments.error.GatewayException;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import java.util.Locale;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

/**
 * Gateway client that asks an external authorization service over HTTP.
 *
 * <p>The {@link RestClient} is expected to carry the base URL and the client-side timeout
 * (see {@link com.github.dimitryivaniuta.gateway.cardpayments.config.GatewayConfig}).
 * Transport failures, timeouts, any non-2xx answer (redirects included) and unreadable bodies surface as
 * {@link GatewayException};
 * only an explicit {@code FAILED} status from the gateway counts as a decline.</p>
 */
public class HttpPaymentGatewayClient implements PaymentGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(HttpPaymentGatewayClient.class);

    /** Path of the authorization endpoint, relative to the configured base URL. */
    public static final String AUTHORIZATIONS_PATH = "/authorizations";

    private final RestClient restClient;

    /**
     * Creates the client.
     *
     * @param restClient preconfigured client (base URL, timeouts)
     */
    public HttpPaymentGatewayClient(RestClient restClient) {
        this.restClient = restClient;
    }

    @Override
    public GatewayDecision authorize(GatewayCredentials credentials, PaymentRequest request, UUID transactionId) {
        if (credentials.isMissing()) {
            throw new EnvironmentException(SimulatedPaymentGatewayClient.MISSING_KEY_MESSAGE);
        }

        AuthorizationResponse response;
        try {
            response = restClient.post()
                    .uri(AUTHORIZATIONS_PATH)
                    .headers(h -> h.setBearerAuth(credentials.apiKey()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .accept(MediaType.APPLICATION_JSON)
                    .body(AuthorizationRequest.of(transactionId, request))
                    .retrieve()
                    .onStatus(status -> !status.is2xxSuccessful(), (req, res) -> {
                        throw new GatewayException("External gateway call failed: HTTP " + res.getStatusCode().value());
                    })
                    .body(AuthorizationResponse.class);
        } catch (RestClientException ex) {
            log.warn("Gateway authorization call failed. transactionId={} error={}", transactionId, ex.getMessage());
            throw GatewayException.from(ex);
        } catch (GatewayException ex) {
            log.warn("Gateway answered outside 2xx. transactionId={} error={}", transactionId, ex.getMessage());
            throw ex;
        }

        return toDecision(transactionId, response);
    }

    private GatewayDecision toDecision(UUID transactionId, AuthorizationResponse response) {
        if (response == null || response.status() == null) {
            throw new GatewayException("External gateway returned an empty authorization response.");
        }

        PaymentStatus outcome;
        try {
            outcome = PaymentStatus.valueOf(response.status().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException ex) {
            throw new GatewayException("External gateway returned an unknown status: " + response.status(), ex);
        }

        String message = response.message() != null ? response.message() : defaultMessage(outcome);
        log.debug("Gateway answered. transactionId={} outcome={}", transactionId, outcome);
        return new GatewayDecision(outcome, message);
    }

    private static String defaultMessage(PaymentStatus outcome) {
        return outcome == PaymentStatus.SUCCESS
                ? SimulatedPaymentGatewayClient.APPROVED_MESSAGE
                : "Card declined by external gateway.";
    }

    /**
     * Wire format of an authorization call.
     */
    public record AuthorizationRequest(
            @JsonProperty("transaction_id") String transactionId,
            int amount,
            String currency,
            @JsonProperty("card_number") String cardNumber,
            @JsonProperty("expiry_month") int expiryMonth,
            @JsonProperty("expiry_year") int expiryYear,
            String cvv
    ) {
        static AuthorizationRequest of(UUID transactionId, PaymentRequest r) {
            return new AuthorizationRequest(transactionId.toString(), r.amount(), r.currency(), r.cardNumber(),
                    r.expiryMonth(), r.expiryYear(), r.cvv());
        }
    }

    /**
     * Wire format of the gateway answer.
     */
    public record AuthorizationResponse(String status, String message) {}
}
