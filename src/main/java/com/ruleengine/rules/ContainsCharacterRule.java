package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;
import lombok.Value;

/**
 * Rule requiring the value to contain a specific character.
 */
@Value
public final class ContainsCharacterRule implements RuleNode {

    char character;

    @Override
    public <R> R accept(RuleVisitor<R> visitor) {
        return visitor.visit(this);
    }

    @Override
    public <I, R> R accept(InputRuleVisitor<I, R> visitor, I input) {
        return visitor.visit(this, input);
    }
}
