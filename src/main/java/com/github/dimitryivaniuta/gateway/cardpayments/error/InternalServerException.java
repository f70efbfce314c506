package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.http.HttpStatus;

/**
 * Infrastructure failure outside the payment flow itself.
 */
public final class InternalServerException extends PaymentException {

    public InternalServerException(String message) {
        super(message);
    }

    public InternalServerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }
}
