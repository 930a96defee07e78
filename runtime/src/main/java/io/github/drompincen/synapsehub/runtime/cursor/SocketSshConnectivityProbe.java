package io.github.drompincen.synapsehub.runtime.cursor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;

/** Treats an SSH target as reachable when its port accepts a TCP connection. */
@Component
public class SocketSshConnectivityProbe implements SshConnectivityProbe {

    private static final Logger log = LoggerFactory.getLogger(SocketSshConnectivityProbe.class);

    @Override
    public boolean isReachable(String host, int port, Duration timeout) {
        try (Socket socket = new Socket()) {
            socket.connect(new InetSocketAddress(host, port), (int) timeout.toMillis());
            return true;
        } catch (IOException e) {
            log.debug("SSH probe to {}:{} failed: {}", host, port, e.getMessage());
            return false;
        }
    }
}
