package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;
import lombok.Value;

import java.util.List;

/**
 * Composite rule satisfied only when every child rule is satisfied.
 * An empty {@code AndRule} is always satisfied.
 */
@Value
public final class AndRule implements RuleNode {

    List<RuleNode> rules;

    public AndRule(List<? extends RuleNode> rules) {
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
