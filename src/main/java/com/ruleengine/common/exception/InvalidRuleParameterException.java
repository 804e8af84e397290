package com.ruleengine.common.exception;

import java.util.List;

/**
 * Thrown when a rule tree carries parameters that strict validation rejects,
 * such as a negative length threshold or an empty character set.
 */
public class InvalidRuleParameterException extends RuleEngineException {

    private final List<String> violations;

    public InvalidRuleParameterException(List<String> violations) {
        super("Invalid rule parameters: " + String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
