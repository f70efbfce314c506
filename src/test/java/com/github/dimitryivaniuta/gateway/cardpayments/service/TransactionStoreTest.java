package com.github.dimitryivaniuta.gateway.cardpayments.service;

import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentStatus;
import com.github.dimitryivaniuta.gateway.cardpayments.domain.PaymentTransaction;
import com.github.dimitryivaniuta.gateway.cardpayments.error.DatabaseException;
import com.github.dimitryivaniuta.gateway.cardpayments.repo.PaymentTransactionRepository;
import java.util.UUID;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.CannotCreateTransactionException;

class TransactionStoreTest {

    private final PaymentTransactionRepository repository = Mockito.mock(PaymentTransactionRepository.class);
    private final TransactionStore store = new TransactionStore(repository);

    @Test
    void insertsOneRowWithGivenValues() {
        Mockito.when(repository.saveAndFlush(Mockito.any())).thenAnswer(inv -> inv.getArgument(0));
        UUID id = UUID.randomUUID();

        PaymentTransaction saved = store.record(id, 1000, "USD", PaymentStatus.FAILED, "XXXX-XXXX-XXXX-0002");

        ArgumentCaptor<PaymentTransaction> captor = ArgumentCaptor.forClass(PaymentTransaction.class);
        Mockito.verify(repository, Mockito.times(1)).saveAndFlush(captor.capture());
        PaymentTransaction row = captor.getValue();
        Assertions.assertSame(row, saved);
        Assertions.assertEquals(id, row.getTransactionUuid());
        Assertions.assertEquals(1000, row.getAmount());
        Assertions.assertEquals("USD", row.getCurrency());
        Assertions.assertEquals(PaymentStatus.FAILED, row.getStatus());
        Assertions.assertEquals("XXXX-XXXX-XXXX-0002", row.getMaskedCardNumber());
    }

    @Test
    void dataAccessFailureBecomesDatabaseErrorWithoutRetry() {
        Mockito.when(repository.saveAndFlush(Mockito.any()))
                .thenThrow(new DataAccessResourceFailureException("connection refused: db-host:5432"));

        DatabaseException ex = Assertions.assertThrows(DatabaseException.class,
                () -> store.record(UUID.randomUUID(), 1000, "USD", PaymentStatus.SUCCESS, "XXXX-XXXX-XXXX-1111"));

        Assertions.assertEquals("Database operation failed.", ex.clientMessage());
        Assertions.assertTrue(ex.getMessage().contains("connection refused"));
        Assertions.assertInstanceOf(DataAccessResourceFailureException.class, ex.getCause());
        Mockito.verify(repository, Mockito.times(1)).saveAndFlush(Mockito.any());
    }

    @Test
    void constraintViolationBecomesDatabaseError() {
        Mockito.when(repository.saveAndFlush(Mockito.any()))
                .thenThrow(new DataIntegrityViolationException("duplicate key value violates unique constraint"));

        Assertions.assertThrows(DatabaseException.class,
                () -> store.record(UUID.randomUUID(), 1000, "USD", PaymentStatus.SUCCESS, "XXXX-XXXX-XXXX-1111"));
    }

    @Test
    void transactionInfrastructureFailureBecomesDatabaseError() {
        Mockito.when(repository.saveAndFlush(Mockito.any()))
                .thenThrow(new CannotCreateTransactionException("Could not open JPA EntityManager for transaction"));

        Assertions.assertThrows(DatabaseException.class,
                () -> store.record(UUID.randomUUID(), 1000, "USD", PaymentStatus.SUCCESS, "XXXX-XXXX-XXXX-1111"));
    }
}
