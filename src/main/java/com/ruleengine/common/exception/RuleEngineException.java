package com.ruleengine.common.exception;

/**
 * Base exception for all rule engine exceptions.
 */
public class RuleEngineException extends RuntimeException {

    public RuleEngineException(String message) {
        super(message);
    }
}
