package com.github.dimitryivaniuta.gateway.cardpayments.service;

/**
 * Derives the display-safe card representation stored with a transaction.
 *
 * <p>Fixed format regardless of card length or network: {@code XXXX-XXXX-XXXX-<last 4>}.</p>
 */
public final class CardMasker {

    private static final String MASK_PREFIX = "XXXX-XXXX-XXXX-";
    private static final int VISIBLE_DIGITS = 4;

    private CardMasker() {}

    /**
     * Masks a card number.
     *
     * @param cardNumber validated card number
     * @return masked card, e.g. {@code XXXX-XXXX-XXXX-1111}
     * @throws IllegalArgumentException if the number is null or shorter than four characters
     */
    public static String mask(String cardNumber) {
        if (cardNumber == null || cardNumber.length() < VISIBLE_DIGITS) {
            throw new IllegalArgumentException("Card number is too short to mask");
        }
        return MASK_PREFIX + cardNumber.substring(cardNumber.length() - VISIBLE_DIGITS);
    }
}
