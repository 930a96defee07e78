package io.github.drompincen.synapsehub.runtime.error;

public class ExternalServiceException extends SynapseHubException {

    private final String service;

    public ExternalServiceException(String message, String service) {
        this(message, service, null);
    }

    public ExternalServiceException(String message, String service, Throwable cause) {
        super(message, "EXTERNAL_SERVICE_ERROR", detail("service", service), cause);
        this.service = service;
    }

    public String getService() { return service; }
}
