package com.flow.sync.service.exception;

/**
 * A single rejected field of a mutation payload.
 */
public record ValidationError(String field, String message) {
}
