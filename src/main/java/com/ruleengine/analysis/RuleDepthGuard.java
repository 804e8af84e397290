package com.ruleengine.analysis;

import com.ruleengine.common.exception.RuleDepthExceededException;
import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;
import com.ruleengine.rules.RuleNode;
import com.ruleengine.visitor.InputRuleVisitor;

import java.util.List;

/**
 * Rejects rule trees nested deeper than a fixed limit.
 *
 * The input of each visit is the depth of the visited node, root at 0.
 * The walk stops at the first node past the limit, so its own recursion
 * never goes more than one level beyond {@code maxDepth}.
 */
public class RuleDepthGuard implements InputRuleVisitor<Integer, Void> {

    private final int maxDepth;

    public RuleDepthGuard(int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must not be negative: " + maxDepth);
        }
        this.maxDepth = maxDepth;
    }

    /**
     * @throws RuleDepthExceededException if any node is deeper than the limit
     */
    public void check(RuleNode rule) {
        rule.accept(this, 0);
    }

    @Override
    public Void visit(AndRule rule, Integer depth) {
        checkChildren(rule.getRules(), depth);
        return null;
    }

    @Override
    public Void visit(OrRule rule, Integer depth) {
        checkChildren(rule.getRules(), depth);
        return null;
    }

    @Override
    public Void visit(MinLengthRule rule, Integer depth) {
        checkDepth(depth);
        return null;
    }

    @Override
    public Void visit(ContainsCharacterRule rule, Integer depth) {
        checkDepth(depth);
        return null;
    }

    @Override
    public Void visit(ContainsAnyOfRule rule, Integer depth) {
        checkDepth(depth);
        return null;
    }

    private void checkChildren(List<RuleNode> children, int depth) {
        checkDepth(depth);
        for (RuleNode child : children) {
            child.accept(this, depth + 1);
        }
    }

    private void checkDepth(int depth) {
        if (depth > maxDepth) {
            throw new RuleDepthExceededException(maxDepth);
        }
    }
}
