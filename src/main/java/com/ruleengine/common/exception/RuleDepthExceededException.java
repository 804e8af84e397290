package com.ruleengine.common.exception;

/**
 * Thrown when a rule tree is nested deeper than the engine accepts.
 */
public class RuleDepthExceededException extends RuleEngineException {

    private final int maxDepth;

    public RuleDepthExceededException(int maxDepth) {
        super(String.format("Rule tree exceeds maximum nesting depth of %d", maxDepth));
        this.maxDepth = maxDepth;
    }

    public int getMaxDepth() {
        return maxDepth;
    }
}
