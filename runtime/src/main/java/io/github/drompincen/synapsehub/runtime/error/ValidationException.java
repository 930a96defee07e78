package io.github.drompincen.synapsehub.runtime.error;

public class ValidationException extends SynapseHubException {

    public ValidationException(String message) {
        super(message, "VALIDATION_ERROR", null);
    }

    public ValidationException(String message, String field) {
        super(message, "VALIDATION_ERROR", detail("field", field));
    }

    public ValidationException(String message, Throwable cause) {
        super(message, "VALIDATION_ERROR", null, cause);
    }
}
