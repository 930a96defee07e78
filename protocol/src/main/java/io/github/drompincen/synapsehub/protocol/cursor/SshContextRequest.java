package io.github.drompincen.synapsehub.protocol.cursor;

import java.util.Map;

/** Registration payload; {@code port} and {@code connectionTimeout} fall back to 22 and 30s. */
public record SshContextRequest(
        String host,
        Integer port,
        String username,
        String keyPath,
        String workingDirectory,
        Map<String, String> environmentVars,
        Integer connectionTimeout
) {}
