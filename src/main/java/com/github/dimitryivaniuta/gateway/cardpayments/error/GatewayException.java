package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.client.RestClientException;

/**
 * The external gateway could not be reached or answered with an error.
 */
public final class GatewayException extends PaymentException {

    public GatewayException(String message) {
        super(message);
    }

    public GatewayException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Converts an HTTP client failure (transport error, timeout, non-2xx status).
     *
     * @param ex client exception
     * @return gateway exception
     */
    public static GatewayException from(RestClientException ex) {
        return new GatewayException("External gateway call failed: " + ex.getMessage(), ex);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.BAD_GATEWAY;
    }
}
