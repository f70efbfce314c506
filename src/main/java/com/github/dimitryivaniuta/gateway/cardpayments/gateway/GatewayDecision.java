package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import java.util.Objects;

/**
 * Authorization result returned by a {@link PaymentGatewayClient}.
 *
 * @param outcome approved or declined
 * @param message gateway message passed through to the caller
 */
public record GatewayDecision(PaymentStatus outcome, String message) {

    public GatewayDecision {
        Objects.requireNonNull(outcome, "outcome");
        Objects.requireNonNull(message, "message");
    }

    /**
     * @return true if the gateway approved the payment
     */
    public boolean approved() {
        return outcome == PaymentStatus.SUCCESS;
    }
}
