package com.ruleengine.visitor;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;

/**
 * Algorithm over a rule tree that receives one extra input per visit,
 * such as the value being tested or an accumulator.
 *
 * @param <I> the input handed to each visit
 * @param <R> the result produced for each visited node
 */
public interface InputRuleVisitor<I, R> {

    R visit(AndRule rule, I input);

    R visit(OrRule rule, I input);

    R visit(MinLengthRule rule, I input);

    R visit(ContainsCharacterRule rule, I input);

    R visit(ContainsAnyOfRule rule, I input);
}
