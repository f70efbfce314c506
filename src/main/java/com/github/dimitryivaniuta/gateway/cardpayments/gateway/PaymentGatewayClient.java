package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import java.util.UUID;

/**
 * Abstraction over the external payment gateway that approves or declines a card payment.
 *
 * <p>Implementations: {@link SimulatedPaymentGatewayClient} (default) and {@link HttpPaymentGatewayClient}.
 * Both share the same contract, so switching between them does not change the payment flow.</p>
 */
public interface PaymentGatewayClient {

    /**
     * Requests an authorization decision.
     *
     * @param credentials configured gateway credential
     * @param request validated payment request
     * @param transactionId id generated for this attempt
     * @return decision; a decline is a normal result, not an exception
     * @throws com.github.dimitryivaniuta.gateway.cardpayments.error.EnvironmentException if the credential is empty
     * @throws com.github.dimitryivaniuta.gateway.cardpayments.error.GatewayException if the gateway call fails
     */
    GatewayDecision authorize(GatewayCredentials credentials, PaymentRequest request, UUID transactionId);
}
