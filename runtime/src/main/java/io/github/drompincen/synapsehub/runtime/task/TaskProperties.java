package io.github.drompincen.synapsehub.runtime.task;

import io.github.drompincen.synapsehub.runtime.error.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "synapsehub.tasks")
public class TaskProperties {

    private int maxPageSize = 100;
    private int defaultMaxRetries = 3;

    public void validate() {
        if (maxPageSize < 1) {
            throw new ConfigurationException("max-page-size must be positive", "synapsehub.tasks.max-page-size");
        }
        if (defaultMaxRetries < 0 || defaultMaxRetries > 10) {
            throw new ConfigurationException("default-max-retries must be within 0..10",
                    "synapsehub.tasks.default-max-retries");
        }
    }

    public int getMaxPageSize() { return maxPageSize; }
    public void setMaxPageSize(int maxPageSize) { this.maxPageSize = maxPageSize; }

    public int getDefaultMaxRetries() { return defaultMaxRetries; }
    public void setDefaultMaxRetries(int defaultMaxRetries) { this.defaultMaxRetries = defaultMaxRetries; }
}
