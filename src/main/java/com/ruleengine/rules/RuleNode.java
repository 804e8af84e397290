package com.ruleengine.rules;

import com.ruleengine.visitor.InputRuleVisitor;
import com.ruleengine.visitor.RuleVisitor;

/**
 * A node of a rule tree.
 *
 * Nodes are immutable data. Algorithms over a tree are written as visitors;
 * each node routes a visit to the visitor method for its own variant, so the
 * caller only ever needs a {@code RuleNode} reference.
 */
public sealed interface RuleNode
        permits AndRule, OrRule, MinLengthRule, ContainsCharacterRule, ContainsAnyOfRule {

    /**
     * Dispatch to a visitor that takes no per-call input.
     *
     * @param visitor the algorithm to run on this node
     * @return whatever the visitor produces for this node
     */
    <R> R accept(RuleVisitor<R> visitor);

    /**
     * Dispatch to a visitor that takes one extra input value.
     *
     * @param visitor the algorithm to run on this node
     * @param input the value handed to the visitor alongside this node
     * @return whatever the visitor produces for this node
     */
    <I, R> R accept(InputRuleVisitor<I, R> visitor, I input);
}
