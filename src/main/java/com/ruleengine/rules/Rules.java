package com.ruleengine.rules;

import java.util.List;

/**
 * Static factory for building rule trees.
 *
 * <pre>
 * RuleNode password = Rules.and(
 *     Rules.minLength(8),
 *     Rules.or(Rules.containsCharacter('!'), Rules.containsAnyOf("?.,")));
 * </pre>
 */
public final class Rules {

    private Rules() {
    }

    public static AndRule and(RuleNode... rules) {
        return new AndRule(List.of(rules));
    }

    public static AndRule and(List<? extends RuleNode> rules) {
        return new AndRule(rules);
    }

    public static OrRule or(RuleNode... rules) {
        return new OrRule(List.of(rules));
    }

    public static OrRule or(List<? extends RuleNode> rules) {
        return new OrRule(rules);
    }

    public static MinLengthRule minLength(int minLength) {
        return new MinLengthRule(minLength);
    }

    public static ContainsCharacterRule containsCharacter(char character) {
        return new ContainsCharacterRule(character);
    }

    public static ContainsAnyOfRule containsAnyOf(String characters) {
        return new ContainsAnyOfRule(characters);
    }
}
