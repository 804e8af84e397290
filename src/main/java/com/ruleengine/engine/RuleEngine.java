package com.ruleengine.engine;

import com.ruleengine.analysis.RuleCounter;
import com.ruleengine.analysis.RuleDepthGuard;
import com.ruleengine.analysis.RuleParameterValidator;
import com.ruleengine.common.exception.InvalidRuleParameterException;
import com.ruleengine.common.exception.RuleDepthExceededException;
import com.ruleengine.evaluation.RuleVerifier;
import com.ruleengine.requirements.RequirementsBuilder;
import com.ruleengine.rules.RuleNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Entry point for evaluating and describing rule trees.
 *
 * Every tree is validated before it is traversed:
 * 1. Reject trees nested deeper than {@code rule-engine.max-depth}
 * 2. In strict mode, reject negative thresholds and empty character sets
 *
 * Rule trees are immutable, so one engine may serve concurrent callers.
 * Input values are never logged.
 */
@Service
@Slf4j
public class RuleEngine {

    @Value("${rule-engine.max-depth:256}")
    private int maxDepth;

    @Value("${rule-engine.strict-parameters:false}")
    private boolean strictParameters;

    /**
     * Test a value against a rule tree.
     *
     * @param rule the root of the tree
     * @param input the value to test
     * @return true if the value satisfies the tree
     */
    public boolean evaluate(RuleNode rule, String input) {
        if (input == null) {
            throw new IllegalArgumentException("Input cannot be null");
        }
        validate(rule);

        if (log.isDebugEnabled()) {
            log.debug("Evaluating rule tree of {} nodes against input of length {}",
                RuleCounter.count(rule), input.length());
        }
        return RuleVerifier.verify(rule, input);
    }

    /**
     * Render a rule tree as indented requirement lines.
     *
     * @param rule the root of the tree
     * @return one line per node, each terminated by a line feed
     */
    public String describe(RuleNode rule) {
        validate(rule);

        if (log.isDebugEnabled()) {
            log.debug("Describing rule tree of {} nodes", RuleCounter.count(rule));
        }
        return RequirementsBuilder.build(rule);
    }

    /**
     * Test a value and explain the failure.
     *
     * @param rule the root of the tree
     * @param input the value to test
     * @return a satisfied result, or an unsatisfied one whose reason is the tree's description
     */
    public RuleCheckResult check(RuleNode rule, String input) {
        if (evaluate(rule, input)) {
            return RuleCheckResult.satisfied();
        }

        log.info("Input of length {} does not satisfy rule tree", input.length());
        return RuleCheckResult.unsatisfied(RequirementsBuilder.build(rule));
    }

    /**
     * Validate a rule tree without traversing it for a value.
     *
     * @throws RuleDepthExceededException if the tree is nested too deeply
     * @throws InvalidRuleParameterException in strict mode, if any parameter is rejected
     */
    public void validate(RuleNode rule) {
        if (rule == null) {
            throw new IllegalArgumentException("Rule cannot be null");
        }

        try {
            new RuleDepthGuard(maxDepth).check(rule);
        } catch (RuleDepthExceededException e) {
            log.warn("Rejected rule tree: {}", e.getMessage());
            throw e;
        }

        if (strictParameters) {
            List<String> violations = RuleParameterValidator.validate(rule);
            if (!violations.isEmpty()) {
                log.warn("Rejected rule tree with {} invalid parameters", violations.size());
                throw new InvalidRuleParameterException(violations);
            }
        }
    }
}
