package com.ruleengine.analysis;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;
import com.ruleengine.rules.RuleNode;
import com.ruleengine.visitor.RuleVisitor;

import java.util.List;

/**
 * Counts the nodes of a rule tree, composites and leaves alike.
 */
public class RuleCounter implements RuleVisitor<Integer> {

    private static final RuleCounter INSTANCE = new RuleCounter();

    public static int count(RuleNode rule) {
        return rule.accept(INSTANCE);
    }

    @Override
    public Integer visit(AndRule rule) {
        return 1 + countChildren(rule.getRules());
    }

    @Override
    public Integer visit(OrRule rule) {
        return 1 + countChildren(rule.getRules());
    }

    @Override
    public Integer visit(MinLengthRule rule) {
        return 1;
    }

    @Override
    public Integer visit(ContainsCharacterRule rule) {
        return 1;
    }

    @Override
    public Integer visit(ContainsAnyOfRule rule) {
        return 1;
    }

    private int countChildren(List<RuleNode> children) {
        return children.stream().mapToInt(child -> child.accept(this)).sum();
    }
}
