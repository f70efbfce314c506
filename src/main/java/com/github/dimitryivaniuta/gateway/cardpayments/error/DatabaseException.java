package com.github.dimitryivaniuta.gateway.cardpayments.error;

import org.springframework.core.NestedRuntimeException;
import org.springframework.http.HttpStatus;

/**
 * Persisting the transaction failed.
 *
 * <p>The driver error travels as the cause and is logged; callers only get a generic message.</p>
 */
public final class DatabaseException extends PaymentException {

    static final String CLIENT_MESSAGE = "Database operation failed.";

    public DatabaseException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Converts a persistence-layer failure.
     *
     * @param ex Spring data access or transaction exception
     * @return database exception
     */
    public static DatabaseException from(NestedRuntimeException ex) {
        return new DatabaseException("Transaction insert failed: " + ex.getMostSpecificCause().getMessage(), ex);
    }

    @Override
    public HttpStatus status() {
        return HttpStatus.INTERNAL_SERVER_ERROR;
    }

    @Override
    public String clientMessage() {
        return CLIENT_MESSAGE;
    }
}
