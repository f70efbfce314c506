package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.http.HttpStatus;

/**
 * Required runtime configuration (e.g. the gateway credential) is missing or empty.
 */
public final class EnvironmentException extends PaymentException {

    public EnvironmentException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
