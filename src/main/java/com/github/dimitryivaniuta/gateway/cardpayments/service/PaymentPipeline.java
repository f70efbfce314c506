package com.github.dimitryivaniuta.gateway.cardpayments.service;

import com.github.dimitryivaniuta.gateway.cardpayments.error.BadRequestException;
import com.github.dimitryivaniuta.gateway.cardpayments.error.PaymentException;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.GatewayCredentials;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.GatewayDecision;
import com.github.dimitryivaniuta.gateway.cardpayments.gateway.PaymentGatewayClient;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentResponse;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Card payment orchestration.
 *
 * <p>Strictly linear flow per request:
 * <ol>
 *   <li>Validate the request (no I/O)</li>
 *   <li>Mask the card and generate the transaction id</li>
 *   <li>Ask the gateway for a decision; on failure nothing is persisted</li>
 *   <li>Persist the attempt with the gateway outcome</li>
 *   <li>Build the response; declines are regular responses with {@code success=false}</li>
 * </ol>
 *
 * <p>If persistence fails after the gateway decided, the decision is lost: there is no reversal call,
 * retry or outbox.</p>
 */
@Service
public class PaymentPipeline {

    private static final Logger log = LoggerFactory.getLogger(PaymentPipeline.class);

    private final PaymentRequestValidator validator;
    private final PaymentGatewayClient gatewayClient;
    private final TransactionStore transactionStore;
    private final GatewayCredentials credentials;

    private final Counter approvedCounter;
    private final Counter declinedCounter;
    private final Counter rejectedCounter;
    private final Counter erroredCounter;

    /**
     * Creates the pipeline.
     *
     * @param validator request validator
     * @param gatewayClient gateway client
     * @param transactionStore transaction store
     * @param credentials gateway credential resolved at startup
     * @param meterRegistry metrics
     */
    public PaymentPipeline(
            PaymentRequestValidator validator,
            PaymentGatewayClient gatewayClient,
            TransactionStore transactionStore,
            GatewayCredentials credentials,
            MeterRegistry meterRegistry
    ) {
        this.validator = validator;
        this.gatewayClient = gatewayClient;
        this.transactionStore = transactionStore;
        this.credentials = credentials;

        this.approvedCounter = outcomeCounter(meterRegistry, "success");
        this.declinedCounter = outcomeCounter(meterRegistry, "declined");
        this.rejectedCounter = outcomeCounter(meterRegistry, "rejected");
        this.erroredCounter = outcomeCounter(meterRegistry, "error");
    }

    /**
     * Processes one payment request.
     *
     * @param request payment request
     * @return response for an approved or declined payment
     * @throws PaymentException for validation, configuration, gateway or database failures
     */
    public PaymentResponse process(PaymentRequest request) {
        validator.validate(request).ifPresent(reason -> {
            rejectedCounter.increment();
            throw new BadRequestException(reason);
        });

        String maskedCard = CardMasker.mask(request.cardNumber());
        UUID transactionId = UUID.randomUUID();

        GatewayDecision decision;
        try {
            decision = gatewayClient.authorize(credentials, request, transactionId);
            transactionStore.record(transactionId, request.amount(), request.currency(), decision.outcome(), maskedCard);
        } catch (PaymentException ex) {
            erroredCounter.increment();
            throw ex;
        }

        if (decision.approved()) {
            approvedCounter.increment();
            log.info("Successful payment: {} ({} {}) transactionId={}", maskedCard, request.amount(), request.currency(), transactionId);
            return PaymentResponse.approved(transactionId, decision.message());
        }

        declinedCounter.increment();
        log.warn("Failed payment: {} ({} {}) transactionId={}", maskedCard, request.amount(), request.currency(), transactionId);
        return PaymentResponse.declined(transactionId, decision.message());
    }

    private static Counter outcomeCounter(MeterRegistry meterRegistry, String outcome) {
        return Counter.builder("payments.processed")
                .tag("outcome", outcome)
                .register(meterRegistry);
    }
}
