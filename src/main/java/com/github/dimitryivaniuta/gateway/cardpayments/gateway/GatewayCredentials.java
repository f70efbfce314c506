package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

/**
 * Credential used to authenticate against the payment gateway.
 *
 * <p>Created once at startup. An empty key is allowed here and rejected per request by the gateway
 * clients.</p>
 *
 * @param apiKey gateway API key, never null
 */
public record GatewayCredentials(String apiKey) {

    private static final int VISIBLE_PREFIX = 5;

    public GatewayCredentials {
        apiKey = apiKey == null ? "" : apiKey;
    }

    /**
     * @return true if no usable key is configured
     */
    public boolean isMissing() {
        return apiKey.isBlank();
    }

    /**
     * Key prefix that may appear in logs.
     *
     * @return first characters of the key followed by an ellipsis
     */
    public String redacted() {
        return apiKey.substring(0, Math.min(VISIBLE_PREFIX, apiKey.length())) + "...";
    }

    @Override
    public String toString() {
        return "GatewayCredentials[apiKey=" + redacted() + "]";
    }
}
