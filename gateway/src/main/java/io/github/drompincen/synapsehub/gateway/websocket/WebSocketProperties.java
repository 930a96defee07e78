package io.github.drompincen.synapsehub.gateway.websocket;

import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Component
@ConfigurationProperties(prefix = "synapsehub.websocket")
public class WebSocketProperties {

    private Duration heartbeatInterval = Duration.ofSeconds(30);
    /** Defaults to twice the heartbeat interval. */
    private Duration staleAfter;
    private List<String> allowedOrigins = List.of("*");
    /** Static bearer tokens accepted by {@code authenticate}, token to user id. */
    private Map<String, String> tokens = new LinkedHashMap<>();

    public void validate() {
        if (heartbeatInterval == null || heartbeatInterval.isZero() || heartbeatInterval.isNegative()) {
            throw new ConfigurationException("heartbeat-interval must be positive",
                    "synapsehub.websocket.heartbeat-interval");
        }
        if (staleAfter != null && (staleAfter.isZero() || staleAfter.isNegative())) {
            throw new ConfigurationException("stale-after must be positive", "synapsehub.websocket.stale-after");
        }
    }

    public Duration effectiveStaleAfter() {
        return staleAfter != null ? staleAfter : heartbeatInterval.multipliedBy(2);
    }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public Duration getStaleAfter() { return staleAfter; }
    public void setStaleAfter(Duration staleAfter) { this.staleAfter = staleAfter; }

    public List<String> getAllowedOrigins() { return allowedOrigins; }
    public void setAllowedOrigins(List<String> allowedOrigins) { this.allowedOrigins = allowedOrigins; }

    public Map<String, String> getTokens() { return tokens; }
    public void setTokens(Map<String, String> tokens) { this.tokens = tokens; }
}
