package com.github.dimitryivaniuta.gateway.cardpayments.web.dto;

/**
 * Error body returned for every failed request.
 *
 * @param error caller-visible message
 */
public record ErrorResponse(String error) {}
