package com.github.dimitryivaniuta.gateway.cardpayments;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentTransaction;
import com.github.dimitryivaniuta.gateway.cardpayments.repo.PaymentTransactionRepository;
import com.github.dimitryivaniuta.gateway.cardpayments.web.RequestCorrelationFilter;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.boot.test.web.client.TestRestTemplate;
import org.springframework.boot.test.web.server.LocalServerPort;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.DynamicPropertyRegistry;
import org.springframework.test.context.DynamicPropertySource;
import org.testcontainers.containers.PostgreSQLContainer;
import org.testcontainers.junit.jupiter.Testcontainers;

/**
 * End-to-end payment flow against a real Postgres (Testcontainers) with the simulated gateway.
 */
@Testcontainers
@SpringBootTest(webEnvironment = SpringBootTest.WebEnvironment.RANDOM_PORT)
class CardPaymentsIT {

    private static final PostgreSQLContainer<?> POSTGRES = new PostgreSQLContainer<>("postgres:16")
            .withDatabaseName("payments")
            .withUsername("payments")
            .withPassword("payments");

    @BeforeAll
    static void start() {
        POSTGRES.start();
    }

    @AfterAll
    static void stop() {
        POSTGRES.stop();
    }

    @DynamicPropertySource
    static void props(DynamicPropertyRegistry r) {
        r.add("spring.datasource.url", POSTGRES::getJdbcUrl);
        r.add("spring.datasource.username", POSTGRES::getUsername);
        r.add("spring.datasource.password", POSTGRES::getPassword);
    }

    @LocalServerPort
    int port;

    @Autowired
    TestRestTemplate rest;

    @Autowired
    PaymentTransactionRepository repository;

    @Autowired
    ObjectMapper objectMapper;

    @BeforeEach
    void clean() {
        repository.deleteAll();
    }

    @Test
    void approvedPaymentIsStoredWithMaskedCard() throws Exception {
        ResponseEntity<String> r = postPayment(Map.of(
                "amount", 1000, "currency", "USD", "card_number", "4111111111111111",
                "expiry_month", 12, "expiry_year", 2030, "cvv", "123"));

        Assertions.assertEquals(200, r.getStatusCode().value());
        JsonNode body = objectMapper.readTree(r.getBody());
        Assertions.assertTrue(body.get("success").asBoolean());

        UUID id = UUID.fromString(body.get("transaction_id").asText());
        PaymentTransaction row = repository.findByTransactionUuid(id).orElseThrow();
        Assertions.assertEquals(PaymentStatus.SUCCESS, row.getStatus());
        Assertions.assertEquals("XXXX-XXXX-XXXX-1111", row.getMaskedCardNumber());
        Assertions.assertEquals(1000, row.getAmount());
        Assertions.assertEquals("USD", row.getCurrency());
        Assertions.assertNotNull(row.getCreatedAt());
        Assertions.assertNotEquals(id.toString(), String.valueOf(row.getId()));
    }

    @Test
    void declinedPaymentIsStoredAsFailed() throws Exception {
        ResponseEntity<String> r = postPayment(Map.of(
                "amount", 1000, "currency", "USD", "card_number", "4000000000000002",
                "expiry_month", 12, "expiry_year", 2030, "cvv", "123"));

        Assertions.assertEquals(200, r.getStatusCode().value());
        JsonNode body = objectMapper.readTree(r.getBody());
        Assertions.assertFalse(body.get("success").asBoolean());

        PaymentTransaction row = repository.findByTransactionUuid(UUID.fromString(body.get("transaction_id").asText()))
                .orElseThrow();
        Assertions.assertEquals(PaymentStatus.FAILED, row.getStatus());
    }

    @Test
    void invalidRequestsPersistNothing() {
        ResponseEntity<String> zeroAmount = postPayment(Map.of(
                "amount", 0, "currency", "USD", "card_number", "4111111111111111",
                "expiry_month", 12, "expiry_year", 2030, "cvv", "123"));
        ResponseEntity<String> shortCard = postPayment(Map.of(
                "amount", 1000, "currency", "USD", "card_number", "41111111",
                "expiry_month", 12, "expiry_year", 2030, "cvv", "123"));

        Assertions.assertEquals(400, zeroAmount.getStatusCode().value());
        Assertions.assertEquals("{\"error\":\"Payment amount must be greater than zero.\"}", zeroAmount.getBody());
        Assertions.assertEquals(400, shortCard.getStatusCode().value());
        Assertions.assertEquals(0, repository.count());
    }

    private ResponseEntity<String> postPayment(Map<String, Object> payload) {
        HttpHeaders h = new HttpHeaders();
        h.setContentType(MediaType.APPLICATION_JSON);
        h.set(RequestCorrelationFilter.CORRELATION_ID_HEADER, "it-" + UUID.randomUUID());
        return rest.exchange("http://localhost:" + port + "/api/payment",
                HttpMethod.POST, new HttpEntity<>(payload, h), String.class);
    }
}
