package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.http.HttpStatus;

/**
 * Closed set of failures a payment request can end with.
 *
 * <p>Each subtype maps to exactly one HTTP status. {@link #clientMessage()} is what the caller sees;
 * it equals {@link #getMessage()} except where internal detail must stay server-side.</p>
 *
 * <p>A gateway decline is not an exception; it is a normal response with {@code success=false}.</p>
 */
public abstract sealed class PaymentException extends RuntimeException
        permits BadRequestException, EnvironmentException, GatewayException, DatabaseException, InternalServerException {

    protected PaymentException(String message) {
        super(message);
    }

    protected PaymentException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * HTTP status this failure is reported with.
     *
     * @return status
     */
    public abstract HttpStatus status();

    /**
     * Message safe to return to the caller.
     *
     * @return message
     */
    public String clientMessage() {
        return getMessage();
    }
}
