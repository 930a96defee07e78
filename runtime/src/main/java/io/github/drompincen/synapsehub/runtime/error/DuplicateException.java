package io.github.drompincen.synapsehub.runtime.error;

import java.util.Map;

public class DuplicateException extends SynapseHubException {

    public DuplicateException(String message, String field, Object value) {
        super(message, "DUPLICATE_ERROR", Map.of("field", field, "value", String.valueOf(value)));
    }
}
