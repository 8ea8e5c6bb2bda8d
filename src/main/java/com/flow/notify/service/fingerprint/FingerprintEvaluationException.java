package com.flow.notify.service.fingerprint;

import com.flow.notify.service.engine.NotifyEngineException;

/**
 * Thrown when a custom fingerprint template cannot be evaluated against an event.
 */
public class FingerprintEvaluationException extends NotifyEngineException {

    public FingerprintEvaluationException(String message, String template) {
        super(message, template, "FINGERPRINT_EVALUATION_ERROR");
    }
}
