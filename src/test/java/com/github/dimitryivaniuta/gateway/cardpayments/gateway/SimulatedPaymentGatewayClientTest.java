package com.github.dimitryivaniuta.gateway.cardpayments.gateway;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.error.EnvironmentException;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import java.util.UUID;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SimulatedPaymentGatewayClientTest {

    private final SimulatedPaymentGatewayClient client = new SimulatedPaymentGatewayClient();
    private final GatewayCredentials credentials = new GatewayCredentials("sk_test_123456");

    @Test
    void approvesRegularCard() {
        GatewayDecision decision = client.authorize(credentials, request("4111111111111111"), UUID.randomUUID());

        Assertions.assertEquals(PaymentStatus.SUCCESS, decision.outcome());
        Assertions.assertTrue(decision.approved());
        Assertions.assertEquals("Payment successfully processed by external gateway.", decision.message());
    }

    @Test
    void declinesCardWithTestPrefix() {
        GatewayDecision decision = client.authorize(credentials, request("4000000000000002"), UUID.randomUUID());

        Assertions.assertEquals(PaymentStatus.FAILED, decision.outcome());
        Assertions.assertFalse(decision.approved());
        Assertions.assertEquals("Card declined: Insufficient funds (Simulation).", decision.message());
    }

    @Test
    void prefixMustBeLeading() {
        GatewayDecision decision = client.authorize(credentials, request("4111400000000000"), UUID.randomUUID());

        Assertions.assertEquals(PaymentStatus.SUCCESS, decision.outcome());
    }

    @Test
    void emptyKeyIsAnEnvironmentError() {
        EnvironmentException ex = Assertions.assertThrows(EnvironmentException.class,
                () -> client.authorize(new GatewayCredentials(""), request("4000000000000002"), UUID.randomUUID()));

        Assertions.assertEquals("API Key is missing.", ex.getMessage());
        Assertions.assertEquals(500, ex.status().value());
    }

    @Test
    void shortKeyIsRedactedWithoutFailing() {
        GatewayCredentials shortKey = new GatewayCredentials("abc");

        Assertions.assertEquals("abc...", shortKey.redacted());
        Assertions.assertEquals(PaymentStatus.SUCCESS,
                client.authorize(shortKey, request("4111111111111111"), UUID.randomUUID()).outcome());
        Assertions.assertFalse(credentials.toString().contains("123456"));
    }

    private static PaymentRequest request(String card) {
        return new PaymentRequest(1000, "USD", card, 12, 2030, "123");
    }
}
