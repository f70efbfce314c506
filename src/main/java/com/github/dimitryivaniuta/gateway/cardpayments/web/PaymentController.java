package com.github.dimitryivaniuta.gateway.cardpayments.web;

import com.github.dimitryivaniuta.gateway.cardpayments.service.PaymentPipeline;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentRequest;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.PaymentResponse;
import jakarta.validation.Valid;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for card payments.
 */
@RestController
@RequestMapping("/api")
public class PaymentController {

    private final PaymentPipeline paymentPipeline;

    /**
     * Creates the controller.
     *
     * @param paymentPipeline payment pipeline
     */
    public PaymentController(PaymentPipeline paymentPipeline) {
        this.paymentPipeline = paymentPipeline;
    }

    /**
     * Processes a card payment.
     *
     * <p>Approved and declined payments both return 200; failures are rendered by {@link ErrorHandlingAdvice}.</p>
     *
     * @param request payment request
     * @return payment response
     */
    @PostMapping(value = "/payment", consumes = MediaType.APPLICATION_JSON_VALUE, produces = MediaType.APPLICATION_JSON_VALUE)
    public ResponseEntity<PaymentResponse> pay(@Valid @RequestBody PaymentRequest request) {
        return ResponseEntity.ok(paymentPipeline.process(request));
    }
}
