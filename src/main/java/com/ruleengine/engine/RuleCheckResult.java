package com.ruleengine.engine;

import lombok.Value;

/**
 * Result of checking a value against a rule tree.
 * An unsatisfied result carries the requirements the value failed to meet.
 */
@Value
public class RuleCheckResult {
    boolean satisfied;
    String reason;

    public static RuleCheckResult satisfied() {
        return new RuleCheckResult(true, null);
    }

    public static RuleCheckResult unsatisfied(String reason) {
        return new RuleCheckResult(false, reason);
    }
}
