package com.github.dimitryivaniuta.gateway.cardpayments.web;

import com.github.dimitryivaniuta.gateway.cardpayments.error.DatabaseException;
import com.github.dimitryivaniuta.gateway.cardpayments.error.InternalServerException;
import com.github.dimitryivaniuta.gateway.cardpayments.error.PaymentException;
import com.github.dimitryivaniuta.gateway.cardpayments.web.dto.ErrorResponse;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.validation.FieldError;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.HttpRequestMethodNotSupportedException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.servlet.resource.NoResourceFoundException;

/**
 * Maps every failure to an {@code {"error": ...}} body with the status of its {@link PaymentException} kind.
 *
 * <p>Routing failures (unknown path, wrong method, wrong content type) keep their protocol status
 * (404, 405, 415) but use the same body. Every handler records the failure kind for the request log line
 * written by {@link RequestCorrelationFilter}.</p>
 */
@Slf4j
@RestControllerAdvice
public class ErrorHandlingAdvice {

    static final String MALFORMED_BODY = "Malformed JSON request body.";
    static final String INTERNAL_ERROR = "Internal server error.";

    private static final String BAD_REQUEST_KIND = "BadRequestException";

    /**
     * Payment flow failures.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(PaymentException.class)
    public ResponseEntity<ErrorResponse> handlePaymentException(PaymentException ex, HttpServletRequest request) {
        recordFailureKind(request, ex.getClass().getSimpleName());
        if (ex instanceof DatabaseException) {
            log.error("Database error: {}", ex.getMessage(), ex.getCause());
        } else if (ex.status().is5xxServerError()) {
            log.error("{} ({}): {}", ex.getClass().getSimpleName(), ex.status().value(), ex.getMessage());
        } else {
            log.debug("Payment rejected: {}", ex.getMessage());
        }
        return ResponseEntity.status(ex.status()).body(new ErrorResponse(ex.clientMessage()));
    }

    /**
     * Missing fields in the request body.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ErrorResponse> handleInvalidBody(MethodArgumentNotValidException ex, HttpServletRequest request) {
        recordFailureKind(request, BAD_REQUEST_KIND);
        FieldError field = ex.getBindingResult().getFieldError();
        String message = field != null
                ? "Invalid field '" + field.getField() + "': " + field.getDefaultMessage()
                : "Invalid request body.";
        return ResponseEntity.badRequest().body(new ErrorResponse(message));
    }

    /**
     * Unparseable JSON or wrong field types.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ErrorResponse> handleUnreadableBody(HttpMessageNotReadableException ex, HttpServletRequest request) {
        recordFailureKind(request, BAD_REQUEST_KIND);
        log.debug("Unreadable request body: {}", ex.getMessage());
        return ResponseEntity.badRequest().body(new ErrorResponse(MALFORMED_BODY));
    }

    /**
     * Unknown path, wrong method or wrong content type.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler({
            NoResourceFoundException.class,
            HttpRequestMethodNotSupportedException.class,
            HttpMediaTypeNotSupportedException.class
    })
    public ResponseEntity<ErrorResponse> handleRouting(Exception ex, HttpServletRequest request) {
        recordFailureKind(request, "Routing");
        HttpStatusCode status = ((org.springframework.web.ErrorResponse) ex).getStatusCode();
        return ResponseEntity.status(status).body(new ErrorResponse(ex.getMessage()));
    }

    /**
     * Fallback: anything unexpected is an internal server error; detail stays in the log.
     *
     * @param ex exception
     * @param request current request
     * @return error response
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<ErrorResponse> handleFallback(Exception ex, HttpServletRequest request) {
        InternalServerException internal = new InternalServerException(INTERNAL_ERROR, ex);
        recordFailureKind(request, internal.getClass().getSimpleName());
        log.error("Unhandled error", ex);
        return ResponseEntity.status(internal.status()).body(new ErrorResponse(internal.clientMessage()));
    }

    private static void recordFailureKind(HttpServletRequest request, String kind) {
        request.setAttribute(RequestCorrelationFilter.FAILURE_KIND_ATTRIBUTE, kind);
    }
}
