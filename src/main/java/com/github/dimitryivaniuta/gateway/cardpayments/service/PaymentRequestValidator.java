package com.github.dimitryivaniuta.gateway.cardpayments.service;

import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Business validation of an inbound payment, applied before any I/O.
 *
 * <p>Rules are checked in order and the first failure wins. Expiry date and CVV are not checked.</p>
 */
@Component
public class PaymentRequestValidator {

    public static final int MIN_CARD_LENGTH = 12;
    public static final int MAX_CARD_LENGTH = 19;

    static final String INVALID_AMOUNT = "Payment amount must be greater than zero.";
    static final String INVALID_CARD = "Invalid card number.";

    /**
     * Validates the request.
     *
     * @param request payment request with all fields present
     * @return rejection reason, or empty if the request is valid
     */
    public Optional<String> validate(PaymentRequest request) {
        if (request.amount() <= 0) {
            return Optional.of(INVALID_AMOUNT);
        }
        int cardLength = request.cardNumber().length();
        if (cardLength < MIN_CARD_LENGTH || cardLength > MAX_CARD_LENGTH) {
            return Optional.of(INVALID_CARD);
        }
        return Optional.empty();
    }
}
