package io.github.drompincen.synapsehub.runtime.error;

import java.util.Map;

/** Valid input that breaks a workflow rule: bad transition, wrong turn, retry limit, full queue. */
public class BusinessLogicException extends SynapseHubException {

    private final String rule;

    public BusinessLogicException(String message, String rule) {
        this(message, rule, Map.of());
    }

    public BusinessLogicException(String message, String rule, Map<String, Object> details) {
        super(message, "BUSINESS_RULE_VIOLATION", merge(details, rule));
        this.rule = rule;
    }

    public String getRule() { return rule; }

    private static Map<String, Object> merge(Map<String, Object> details, String rule) {
        Map<String, Object> merged = detail("rule", rule);
        if (details != null) merged.putAll(details);
        return merged;
    }
}
