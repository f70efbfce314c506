package com.github.dimitryivaniuta.gateway.cardpayments.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

/**
 * Response returned for a processed payment, approved or declined.
 *
 * @param success whether the gateway approved the payment
 * @param transactionId id of the persisted transaction
 * @param message gateway message
 * @param timestamp UTC time the response was built, without offset
 */
public record PaymentResponse(
        boolean success,
        @JsonProperty("transaction_id") String transactionId,
        String message,
        LocalDateTime timestamp
) {

    /**
     * Approved payment.
     *
     * @param transactionId transaction id
     * @param message gateway message
     * @return response
     */
    public static PaymentResponse approved(UUID transactionId, String message) {
        return new PaymentResponse(true, transactionId.toString(), message, LocalDateTime.now(ZoneOffset.UTC));
    }

    /**
     * Declined payment.
     *
     * @param transactionId transaction id
     * @param message gateway message
     * @return response
     */
    public static PaymentResponse declined(UUID transactionId, String message) {
        return new PaymentResponse(false, transactionId.toString(), message, LocalDateTime.now(ZoneOffset.UTC));
    }
}
