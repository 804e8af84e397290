package com.ruleengine.evaluation;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;
import com.ruleengine.rules.RuleNode;
import com.ruleengine.visitor.InputRuleVisitor;

/**
 * Decides whether a value satisfies a rule tree.
 *
 * Composite rules short-circuit on the first deciding child. The verifier is
 * stateless, so the shared instance may be used from any thread.
 */
public class RuleVerifier implements InputRuleVisitor<String, Boolean> {

    private static final RuleVerifier INSTANCE = new RuleVerifier();

    /**
     * Test a value against a rule tree.
     *
     * @param rule the root of the tree
     * @param input the value to test
     * @return true if the value satisfies the tree
     */
    public static boolean verify(RuleNode rule, String input) {
        return rule.accept(INSTANCE, input);
    }

    @Override
    public Boolean visit(AndRule rule, String input) {
        return rule.getRules().stream().allMatch(r -> r.accept(this, input));
    }

    @Override
    public Boolean visit(OrRule rule, String input) {
        return rule.getRules().stream().anyMatch(r -> r.accept(this, input));
    }

    @Override
    public Boolean visit(MinLengthRule rule, String input) {
        return input.length() >= rule.getMinLength();
    }

    @Override
    public Boolean visit(ContainsCharacterRule rule, String input) {
        return input.indexOf(rule.getCharacter()) >= 0;
    }

    @Override
    public Boolean visit(ContainsAnyOfRule rule, String input) {
        return rule.getCharacters().chars().anyMatch(c -> input.indexOf(c) >= 0);
    }
}
