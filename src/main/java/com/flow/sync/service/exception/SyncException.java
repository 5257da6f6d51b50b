package com.flow.sync.service.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base exception for every typed failure of the sync engine.
 *
 * Carries a stable error code and structured details naming the offending
 * node, port, group or field so callers can render an actionable message.
 */
public class SyncException extends RuntimeException {

    private final String entityId;
    private final String errorCode;
    private final Map<String, Object> details;

    public SyncException(String message, String entityId, String errorCode) {
        this(message, entityId, errorCode, Map.of(), null);
    }

    public SyncException(String message, String entityId, String errorCode, Map<String, Object> details) {
        this(message, entityId, errorCode, details, null);
    }

    public SyncException(String message, String entityId, String errorCode,
                         Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
        this.details = details == null || details.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
