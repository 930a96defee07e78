package io.github.drompincen.synapsehub.runtime.error;

import java.util.Map;

public class NotFoundException extends SynapseHubException {

    public NotFoundException(String resource, String id) {
        super(resource + " not found: " + id, "NOT_FOUND", Map.of("resource", resource, "id", String.valueOf(id)));
    }
}
