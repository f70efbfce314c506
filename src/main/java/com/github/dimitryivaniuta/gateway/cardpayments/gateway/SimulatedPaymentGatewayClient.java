package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.error.EnvironmentException;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Deterministic gateway used for local development and tests.
 *
 * <p>Cards starting with {@value #DECLINED_PREFIX} are declined, everything else is approved.</p>
 */
public class SimulatedPaymentGatewayClient implements PaymentGatewayClient {

    private static final Logger log = LoggerFactory.getLogger(SimulatedPaymentGatewayClient.class);

    /** Test hook: card numbers with this prefix are always declined. */
    public static final String DECLINED_PREFIX = "4000";

    static final String MISSING_KEY_MESSAGE = "API Key is missing.";
    static final String DECLINED_MESSAGE = "Card declined: Insufficient funds (Simulation).";
    static final String APPROVED_MESSAGE = "Payment successfully processed by external gateway.";

    @Override
    public GatewayDecision authorize(GatewayCredentials credentials, PaymentRequest request, UUID transactionId) {
        if (credentials.isMissing()) {
            throw new EnvironmentException(MISSING_KEY_MESSAGE);
        }

        if (request.cardNumber().startsWith(DECLINED_PREFIX)) {
            return new GatewayDecision(PaymentStatus.FAILED, DECLINED_MESSAGE);
        }

        log.debug("External gateway call successful. transactionId={} key={}", transactionId, credentials.redacted());
        return new GatewayDecision(PaymentStatus.SUCCESS, APPROVED_MESSAGE);
    }
}
