package com.github.dimitryivaniuta.gateway.cardpayments.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;
import java.util.regex.Pattern;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Tags each request with a correlation id and writes one completion line per request.
 *
 * <p>Header: {@code X-Correlation-Id}. A caller-supplied id is reused only if it is a short token
 * ({@code [A-Za-z0-9._:-]}, at most 64 characters); anything else is replaced by a new UUID so caller
 * input never reaches the log pattern verbatim. The id is echoed on the response and exposed to log
 * patterns as MDC key {@value #MDC_KEY}.</p>
 *
 * <p>The completion line carries the failure kind recorded by {@link ErrorHandlingAdvice} under
 * {@link #FAILURE_KIND_ATTRIBUTE}. 5xx completions are logged at WARN.</p>
 */
@Slf4j
@Component
public class RequestCorrelationFilter extends OncePerRequestFilter {

    /**
     * Header name for correlation id.
     */
    public static final String CORRELATION_ID_HEADER = "X-Correlation-Id";

    /**
     * MDC key.
     */
    public static final String MDC_KEY = "correlationId";

    /**
     * Request attribute holding the failure kind of a request that ended in an error response.
     */
    public static final String FAILURE_KIND_ATTRIBUTE = RequestCorrelationFilter.class.getName() + ".failureKind";

    private static final Pattern ACCEPTED_ID = Pattern.compile("[A-Za-z0-9._:-]{1,64}");

    @Override
    protected void doFilterInternal(HttpServletRequest request, HttpServletResponse response, FilterChain chain)
            throws ServletException, IOException {

        String correlationId = resolveCorrelationId(request.getHeader(CORRELATION_ID_HEADER));
        response.setHeader(CORRELATION_ID_HEADER, correlationId);
        MDC.put(MDC_KEY, correlationId);

        long started = System.nanoTime();
        try {
            chain.doFilter(request, response);
        } finally {
            logCompletion(request, response.getStatus(), (System.nanoTime() - started) / 1_000_000);
            MDC.remove(MDC_KEY);
        }
    }

    static String resolveCorrelationId(String header) {
        if (header != null && ACCEPTED_ID.matcher(header).matches()) {
            return header;
        }
        return UUID.randomUUID().toString();
    }

    private static void logCompletion(HttpServletRequest request, int status, long elapsedMs) {
        Object failureKind = request.getAttribute(FAILURE_KIND_ATTRIBUTE);
        if (status >= 500) {
            log.warn("HTTP {} {} -> {} [{}] in {}ms", request.getMethod(), request.getRequestURI(), status,
                    failureKind != null ? failureKind : "unhandled", elapsedMs);
        } else if (failureKind != null) {
            log.info("HTTP {} {} -> {} [{}] in {}ms", request.getMethod(), request.getRequestURI(), status,
                    failureKind, elapsedMs);
        } else {
            log.info("HTTP {} {} -> {} in {}ms", request.getMethod(), request.getRequestURI(), status, elapsedMs);
        }
    }
}
