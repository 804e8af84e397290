package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;
import lombok.Value;

import java.util.List;

/**
 * Composite rule satisfied when at least one child rule is satisfied.
 * An empty {@code OrRule} is never satisfied.
 */
@Value
public final class OrRule implements RuleNode {

    List<RuleNode> rules;

    public OrRule(List<? extends RuleNode> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public <I, R> R accept(InputRuleVisitor<I, R> visitor, I input) {
        return visitor.visit(this, input);
    }
}
