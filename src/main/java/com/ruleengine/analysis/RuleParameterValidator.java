package com.ruleengine.analysis;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;
import com.ruleengine.rules.RuleNode;
import com.ruleengine.visitor.RuleVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects rule parameters that are legal but almost certainly mistakes:
 * negative length thresholds and empty character sets.
 *
 * Violations are returned in tree order; an empty list means the tree is clean.
 */
public class RuleParameterValidator implements RuleVisitor<List<String>> {

    private static final RuleParameterValidator INSTANCE = new RuleParameterValidator();

    public static List<String> validate(RuleNode rule) {
        return rule.accept(INSTANCE);
    }

    @Override
    public List<String> visit(AndRule rule) {
        return validateChildren(rule.getRules());
    }

    @Override
    public List<String> visit(OrRule rule) {
        return validateChildren(rule.getRules());
    }

    @Override
    public List<String> visit(MinLengthRule rule) {
        if (rule.getMinLength() < 0) {
            return List.of("Minimum length must not be negative: " + rule.getMinLength());
        }
        return List.of();
    }

    @Override
    public List<String> visit(ContainsCharacterRule rule) {
        return List.of();
    }

    @Override
    public List<String> visit(ContainsAnyOfRule rule) {
        if (rule.getCharacters().isEmpty()) {
            return List.of("Character set must not be empty");
        }
        return List.of();
    }

    private List<String> validateChildren(List<RuleNode> children) {
        List<String> violations = new ArrayList<>();
        for (RuleNode child : children) {
            violations.addAll(child.accept(this));
        }
        return violations;
    }
}
