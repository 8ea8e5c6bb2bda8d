package com.flow.notify.service.engine;

/**
 * Base exception for notification engine failures.
 *
 * Carries an error code that the API layer maps to an HTTP status.
 */
public class NotifyEngineException extends RuntimeException {

    private final String entityId;
    private final String errorCode;

    public NotifyEngineException(String message) {
        this(message, null, "ENGINE_ERROR");
    }

    public NotifyEngineException(String message, Throwable cause) {
        super(message, cause);
        this.entityId = null;
        this.errorCode = "ENGINE_ERROR";
    }

    public NotifyEngineException(String message, String entityId, String errorCode) {
        super(message);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public NotifyEngineException(String message, String entityId, String errorCode, Throwable cause) {
        super(message, cause);
        this.entityId = entityId;
        this.errorCode = errorCode;
    }

    public String getEntityId() {
        return entityId;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
