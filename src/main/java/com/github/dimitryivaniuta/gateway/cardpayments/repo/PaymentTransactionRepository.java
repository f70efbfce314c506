package com.github.dimitryivaniuta.gateway.cardpayments.repo;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentTransaction;
import java.util.Optional;
import java.util.UUID;
import org.springframework.data.jpa.repository.JpaRepository;

/**
 * JPA repository for {@link PaymentTransaction}.
 */
public interface PaymentTransactionRepository extends JpaRepository<PaymentTransaction, Long> {

    /**
     * Finds a transaction by its public identifier.
     *
     * @param transactionUuid transaction id returned to callers
     * @return transaction
     */
    Optional<PaymentTransaction> findByTransactionUuid(UUID transactionUuid);
}
