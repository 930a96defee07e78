package io.github.drompincen.synapsehub.protocol.cursor;

import java.util.List;

public record AgentRegistrationRequest(
        String version,
        String hostname,
        List<String> capabilities
) {}
