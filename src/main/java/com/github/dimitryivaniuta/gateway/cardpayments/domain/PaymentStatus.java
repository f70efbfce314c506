package com.github.dimitryivaniuta.gateway.cardpayments.domain;

/**
 * Outcome of a gateway authorization, stored as a string in the database.
 */
public enum PaymentStatus {
    /** Approved by the gateway. */
    SUCCESS,

    /** Declined by the gateway. Not an infrastructure error. */
    FAILED
}
