package com.github.dimitryivaniuta.gateway.cardpayments.service;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentTransaction;
import com.github.dimitryivaniuta.gateway.cardpayments.error.DatabaseException;
import com.github.dimitryivaniuta.gateway.cardpayments.repo.PaymentTransactionRepository;
import java.util.UUID;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.TransactionException;

/**
 * Append-only store of payment attempts.
 *
 * <p>Each call inserts exactly one row and is never retried. The insert is flushed inside the repository
 * call so constraint and connection failures surface here, not later at commit.</p>
 */
@Service
public class TransactionStore {

    private final PaymentTransactionRepository repository;

    /**
     * Creates the store.
     *
     * @param repository transaction repository
     */
    public TransactionStore(PaymentTransactionRepository repository) {
        this.repository = repository;
    }

    /**
     * Records a payment attempt.
     *
     * @param transactionId server-generated transaction id
     * @param amount amount in minor units
     * @param currency currency code
     * @param status gateway outcome
     * @param maskedCard masked card number
     * @return persisted transaction
     * @throws DatabaseException if the insert fails
     */
    public PaymentTransaction record(UUID transactionId, int amount, String currency, PaymentStatus status, String maskedCard) {
        PaymentTransaction transaction = PaymentTransaction.attempt(transactionId, amount, currency, status, maskedCard);
        try {
            return repository.saveAndFlush(transaction);
        } catch (DataAccessException | TransactionException ex) {
            throw DatabaseException.from(ex);
        }
    }
}
