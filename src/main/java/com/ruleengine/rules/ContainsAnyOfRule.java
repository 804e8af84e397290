package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;
import lombok.Value;

import java.util.Objects;

/**
 * Rule requiring the value to contain at least one of the given characters.
 *
 * The characters are kept exactly as supplied, duplicates and order included,
 * so they can be shown back to the user. For matching they are read as a set.
 * An empty set is never satisfied.
 */
@Value
public final class ContainsAnyOfRule implements RuleNode {

    String characters;

    public ContainsAnyOfRule(String characters) {
        this.characters = Objects.requireNonNull(characters, "characters must not be null");
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
