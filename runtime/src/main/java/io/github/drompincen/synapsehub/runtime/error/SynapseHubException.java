package io.github.drompincen.synapsehub.runtime.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base of the hub's error taxonomy. Each subclass maps to one response status at the HTTP edge
 * and to an {@code error} event on WebSocket connections.
 */
public class SynapseHubException extends RuntimeException {

    private final String errorCode;
    private final Map<String, Object> details;

    public SynapseHubException(String message, String errorCode, Map<String, Object> details) {
        this(message, errorCode, details, null);
    }

    public SynapseHubException(String message, String errorCode, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public String getErrorCode() { return errorCode; }
    public Map<String, Object> getDetails() { return details; }

    static Map<String, Object> detail(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        if (value != null) map.put(key, value);
        return map;
    }
}
