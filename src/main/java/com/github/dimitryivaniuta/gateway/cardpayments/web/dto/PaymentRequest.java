package com.github.dimitryivaniuta.gateway.cardpayments.web.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.NotNull;

/**
 * Inbound card payment.
 *
 * <p>Bean Validation only checks that every field is present. Business rules (positive amount,
 * card number length) are applied by
 * {@link com.github.dimitryivaniuta.gateway.cardpayments.service.PaymentRequestValidator}.</p>
 *
 * @param amount amount in minor currency units
 * @param currency currency code, e.g. {@code USD}
 * @param cardNumber card number digits
 * @param expiryMonth expiry month
 * @param expiryYear expiry year
 * @param cvv card verification value
 */
public record PaymentRequest(
        @NotNull Integer amount,
        @NotNull String currency,
        @NotNull @JsonProperty("card_number") String cardNumber,
        @NotNull @JsonProperty("expiry_month") Integer expiryMonth,
        @NotNull @JsonProperty("expiry_year") Integer expiryYear,
        @NotNull String cvv
) {
    @Override
    public String toString() {
        return "PaymentRequest[amount=" + amount + ", currency=" + currency + ", cardNumber=****, expiry=**/**, cvv=***]";
    }
}
