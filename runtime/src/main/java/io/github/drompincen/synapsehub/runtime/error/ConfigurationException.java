package io.github.drompincen.synapsehub.runtime.error;

public class ConfigurationException extends SynapseHubException {

    private final String configKey;

    public ConfigurationException(String message, String configKey) {
        super(message, "CONFIGURATION_ERROR", detail("config_key", configKey));
        this.configKey = configKey;
    }

    public String getConfigKey() { return configKey; }
}
