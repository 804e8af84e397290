package com.ruleengine.visitor;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;

/**
 * Algorithm over a rule tree that needs no per-call input.
 *
 * Implementations handle every rule variant. Adding a variant adds a method
 * here and so breaks every visitor until it handles the new variant.
 *
 * @param <R> the result produced for each visited node
 */
public interface RuleVisitor<R> {

    R visit(AndRule rule);

    R visit(OrRule rule);

    R visit(MinLengthRule rule);

    R visit(ContainsCharacterRule rule);

    R visit(ContainsAnyOfRule rule);
}
