package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;
import lombok.Value;

/**
 * Rule requiring the value to have at least {@code minLength} characters.
 * A threshold of zero or below is satisfied by every value.
 */
@Value
public final class MinLengthRule implements RuleNode {

    int minLength;

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public <I, R> R accept(InputRuleVisitor<I, R> visitor, I input) {
        return visitor.visit(this, input);
    }
}
