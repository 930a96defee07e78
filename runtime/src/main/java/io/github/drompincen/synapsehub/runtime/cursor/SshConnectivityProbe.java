package io.github.drompincen.synapsehub.runtime.cursor;

import java.time.Duration;

public interface SshConnectivityProbe {
    boolean isReachable(String host, int port, Duration timeout);
}
