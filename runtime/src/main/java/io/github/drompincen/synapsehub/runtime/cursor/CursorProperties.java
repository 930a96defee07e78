package io.github.drompincen.synapsehub.runtime.cursor;

import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "synapsehub.cursor")
public class CursorProperties {

    private boolean autoStart = true;
    private Duration connectionCheckInterval = Duration.ofSeconds(5);
    private Duration heartbeatInterval = Duration.ofSeconds(30);
    private Duration processingInterval = Duration.ofMillis(100);
    private Duration commandTimeout = Duration.ofSeconds(300);
    private int maxRetries = 3;
    private int queueMaxSize = 1000;
    private Duration completedRetention = Duration.ofMinutes(5);
    private boolean enableSshContext = true;
    /** Defaults to twice the heartbeat interval. */
    private Duration agentStaleAfter;
    private Duration sshProbeTimeout = Duration.ofSeconds(5);
    private RetryBackoff retryBackoff = new RetryBackoff();

    public static class RetryBackoff {
        private RetryBackoffPolicy.Strategy strategy = RetryBackoffPolicy.Strategy.EXPONENTIAL;
        private Duration initialDelay = Duration.ofSeconds(2);
        private Duration maxDelay = Duration.ofSeconds(60);

        public RetryBackoffPolicy.Strategy getStrategy() { return strategy; }
        public void setStrategy(RetryBackoffPolicy.Strategy strategy) { this.strategy = strategy; }

        public Duration getInitialDelay() { return initialDelay; }
        public void setInitialDelay(Duration initialDelay) { this.initialDelay = initialDelay; }

        public Duration getMaxDelay() { return maxDelay; }
        public void setMaxDelay(Duration maxDelay) { this.maxDelay = maxDelay; }
    }

    public void validate() {
        positive(connectionCheckInterval, "connection-check-interval");
        positive(heartbeatInterval, "heartbeat-interval");
        positive(processingInterval, "processing-interval");
        positive(commandTimeout, "command-timeout");
        positive(completedRetention, "completed-retention");
        positive(sshProbeTimeout, "ssh-probe-timeout");
        if (agentStaleAfter != null) positive(agentStaleAfter, "agent-stale-after");
        if (queueMaxSize < 1) {
            throw new ConfigurationException("queue-max-size must be positive", "synapsehub.cursor.queue-max-size");
        }
        if (maxRetries < 0 || maxRetries > 10) {
            throw new ConfigurationException("max-retries must be within 0..10", "synapsehub.cursor.max-retries");
        }
        if (retryBackoff.getStrategy() == null || retryBackoff.getInitialDelay() == null
                || retryBackoff.getInitialDelay().isNegative()) {
            throw new ConfigurationException("retry-backoff needs a strategy and a non-negative initial-delay",
                    "synapsehub.cursor.retry-backoff");
        }
        if (retryBackoff.getMaxDelay() == null || retryBackoff.getMaxDelay().compareTo(retryBackoff.getInitialDelay()) < 0) {
            throw new ConfigurationException("retry-backoff.max-delay must not be below initial-delay",
                    "synapsehub.cursor.retry-backoff.max-delay");
        }
    }

    private static void positive(Duration value, String key) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new ConfigurationException(key + " must be positive", "synapsehub.cursor." + key);
        }
    }

    public Duration effectiveAgentStaleAfter() {
        return agentStaleAfter != null ? agentStaleAfter : heartbeatInterval.multipliedBy(2);
    }

    public boolean isAutoStart() { return autoStart; }
    public void setAutoStart(boolean autoStart) { this.autoStart = autoStart; }

    public Duration getConnectionCheckInterval() { return connectionCheckInterval; }
    public void setConnectionCheckInterval(Duration connectionCheckInterval) { this.connectionCheckInterval = connectionCheckInterval; }

    public Duration getHeartbeatInterval() { return heartbeatInterval; }
    public void setHeartbeatInterval(Duration heartbeatInterval) { this.heartbeatInterval = heartbeatInterval; }

    public Duration getProcessingInterval() { return processingInterval; }
    public void setProcessingInterval(Duration processingInterval) { this.processingInterval = processingInterval; }

    public Duration getCommandTimeout() { return commandTimeout; }
    public void setCommandTimeout(Duration commandTimeout) { this.commandTimeout = commandTimeout; }

    public int getMaxRetries() { return maxRetries; }
    public void setMaxRetries(int maxRetries) { this.maxRetries = maxRetries; }

    public int getQueueMaxSize() { return queueMaxSize; }
    public void setQueueMaxSize(int queueMaxSize) { this.queueMaxSize = queueMaxSize; }

    public Duration getCompletedRetention() { return completedRetention; }
    public void setCompletedRetention(Duration completedRetention) { this.completedRetention = completedRetention; }

    public boolean isEnableSshContext() { return enableSshContext; }
    public void setEnableSshContext(boolean enableSshContext) { this.enableSshContext = enableSshContext; }

    public Duration getAgentStaleAfter() { return agentStaleAfter; }
    public void setAgentStaleAfter(Duration agentStaleAfter) { this.agentStaleAfter = agentStaleAfter; }

    public Duration getSshProbeTimeout() { return sshProbeTimeout; }
    public void setSshProbeTimeout(Duration sshProbeTimeout) { this.sshProbeTimeout = sshProbeTimeout; }

    public RetryBackoff getRetryBackoff() { return retryBackoff; }
    public void setRetryBackoff(RetryBackoff retryBackoff) { this.retryBackoff = retryBackoff; }
}
