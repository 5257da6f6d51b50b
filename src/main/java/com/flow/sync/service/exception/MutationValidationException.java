package com.flow.sync.service.exception;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Thrown when a mutation payload is malformed.
 */
public class MutationValidationException extends SyncException {

    public static final String CODE = "VALIDATION_ERROR";

    private final List<ValidationError> errors;

    public MutationValidationException(String entityId, List<ValidationError> errors) {
        super(summarize(errors), entityId, CODE, Map.of("errors", List.copyOf(errors)));
        this.errors = List.copyOf(errors);
    }

    public static MutationValidationException of(String entityId, String field, String message) {
        return new MutationValidationException(entityId, List.of(new ValidationError(field, message)));
    }

    public List<ValidationError> getErrors() {
        return errors;
    }

    private static String summarize(List<ValidationError> errors) {
        return errors.stream()
                .map(error -> error.field() + ": " + error.message())
                .collect(Collectors.joining(", ", "Invalid mutation: ", ""));
    }
}
