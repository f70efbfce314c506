package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.http.HttpStatus;

/**
 * The request failed validation; the caller must fix its input.
 */
public final class BadRequestException extends PaymentException {

    public BadRequestException(String message) {
        super(message);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_REQUEST;
    }
}
