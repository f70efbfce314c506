package com.github.dimitryivaniuta.gateway.cardpayments.domain;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import java.time.Instant;
import java.util.Objects;
import java.util.UUID;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/**
 * Durable record of one payment attempt and its gateway outcome.
 *
 * <p>Rows are insert-only: every column is non-updatable and the entity has no setters.
 * {@code transactionUuid} is the identifier shown to callers; {@code id} is a storage surrogate.</p>
 */
@Entity
@Table(name = "transactions")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class PaymentTransaction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false, updatable = false)
    private Long id;

    @Column(name = "transaction_uuid", nullable = false, updatable = false, unique = true)
    private UUID transactionUuid;

    @Column(name = "amount", nullable = false, updatable = false)
    private Integer amount;

    @Column(name = "currency", nullable = false, updatable = false, length = 8)
    private String currency;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, updatable = false, length = 16)
    private PaymentStatus status;

    @Column(name = "masked_card_number", nullable = false, updatable = false, length = 32)
    private String maskedCardNumber;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    /**
     * Factory method.
     *
     * @param transactionUuid server-generated transaction id
     * @param amount amount in minor units
     * @param currency currency code
     * @param status gateway outcome
     * @param maskedCardNumber display-safe card number
     * @return new, not yet persisted transaction
     */
    public static PaymentTransaction attempt(UUID transactionUuid, int amount, String currency,
                                             PaymentStatus status, String maskedCardNumber) {
        PaymentTransaction t = new PaymentTransaction();
        t.transactionUuid = Objects.requireNonNull(transactionUuid, "transactionUuid");
        t.amount = amount;
        t.currency = currency;
        t.status = Objects.requireNonNull(status, "status");
        t.maskedCardNumber = Objects.requireNonNull(maskedCardNumber, "maskedCardNumber");
        return t;
    }

    @PrePersist
    void stampCreatedAt() {
        this.createdAt = Instant.now();
    }
}
