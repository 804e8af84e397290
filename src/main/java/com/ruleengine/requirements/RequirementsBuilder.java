package com.ruleengine.requirements;

import com.ruleengine.rules.AndRule;
import com.ruleengine.rules.ContainsAnyOfRule;
import com.ruleengine.rules.ContainsCharacterRule;
import com.ruleengine.rules.MinLengthRule;
import com.ruleengine.rules.OrRule;
import com.ruleengine.rules.RuleNode;
import com.ruleengine.visitor.InputRuleVisitor;

import java.util.List;

/**
 * Renders a rule tree as indented, human-readable requirements.
 *
 * Every node produces one line, parents before children, children in declared
 * order. Root lines are flush left; a line at level {@code n > 0} is indented
 * by {@code n - 1} two-space units followed by {@code "- "}. Example:
 *
 * <pre>
 * All the following conditions must be true:
 * - The value must have at least 8 characters
 * - One of the following conditions must be true:
 *   - The value must contain the character !
 * </pre>
 */
public class RequirementsBuilder implements InputRuleVisitor<RequirementsContext, Void> {

    static final String ALL_HEADING = "All the following conditions must be true:";
    static final String ONE_HEADING = "One of the following conditions must be true:";

    private static final RequirementsBuilder INSTANCE = new RequirementsBuilder();

    /**
     * Describe a rule tree.
     *
     * @param rule the root of the tree
     * @return the description, one line per node, each terminated by a line feed
     */
    public static String build(RuleNode rule) {
        RequirementsContext context = new RequirementsContext();
        rule.accept(INSTANCE, context);
        return context.toString();
    }

    @Override
    public Void visit(AndRule rule, RequirementsContext context) {
        context.appendLine(ALL_HEADING);
        visitChildren(rule.getRules(), context);
        return null;
    }

    @Override
    public Void visit(OrRule rule, RequirementsContext context) {
        context.appendLine(ONE_HEADING);
        visitChildren(rule.getRules(), context);
        return null;
    }

    @Override
    public Void visit(MinLengthRule rule, RequirementsContext context) {
        context.appendLine("The value must have at least " + rule.getMinLength() + " characters");
        return null;
    }

    @Override
    public Void visit(ContainsCharacterRule rule, RequirementsContext context) {
        context.appendLine("The value must contain the character " + rule.getCharacter());
        return null;
    }

    @Override
    public Void visit(ContainsAnyOfRule rule, RequirementsContext context) {
        context.appendLine("The value must contain at least one of these characters: " + rule.getCharacters());
        return null;
    }

    private void visitChildren(List<RuleNode> children, RequirementsContext context) {
        for (RuleNode child : children) {
            child.accept(this, context.nested());
        }
    }
}
