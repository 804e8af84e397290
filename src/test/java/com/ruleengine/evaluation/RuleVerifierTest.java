package com.ruleengine.evaluation;

import com.ruleengine.rules.RuleNode;
import com.ruleengine.rules.Rules;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for rule tree satisfaction.
 */
class RuleVerifierTest {

    private static final List<String> INPUTS = List.of("", "a", "hello!", "hello world", "ab@defgh", "?");

    @Test
    void testEmptyAndIsAlwaysSatisfied() {
        for (String input : INPUTS) {
            assertTrue(RuleVerifier.verify(Rules.and(), input), input);
        }
    }

    @Test
    void testEmptyOrIsNeverSatisfied() {
        for (String input : INPUTS) {
            assertFalse(RuleVerifier.verify(Rules.or(), input), input);
        }
    }

    @Test
    void testEmptyCharacterSetIsNeverSatisfied() {
        for (String input : INPUTS) {
            assertFalse(RuleVerifier.verify(Rules.containsAnyOf(""), input), input);
        }
    }

    @Test
    void testMinLengthComparesLength() {
        for (int threshold = -3; threshold <= 12; threshold++) {
            for (String input : INPUTS) {
                assertEquals(input.length() >= threshold,
                    RuleVerifier.verify(Rules.minLength(threshold), input),
                    threshold + " / " + input);
            }
        }
    }

    @Test
    void testNegativeMinLengthAcceptsEmptyInput() {
        assertTrue(RuleVerifier.verify(Rules.minLength(-1), ""));
    }

    @Test
    void testContainsCharacter() {
        assertTrue(RuleVerifier.verify(Rules.containsCharacter('@'), "a@b"));
        assertFalse(RuleVerifier.verify(Rules.containsCharacter('@'), "ab"));
        assertFalse(RuleVerifier.verify(Rules.containsCharacter('A'), "a"));
    }

    @Test
    void testContainsAnyOf() {
        assertTrue(RuleVerifier.verify(Rules.containsAnyOf("?.,"), "really."));
        assertTrue(RuleVerifier.verify(Rules.containsAnyOf("xxy"), "y"));
        assertFalse(RuleVerifier.verify(Rules.containsAnyOf("?.,"), "hello"));
    }

    @Test
    void testAndCombinesChildrenWithConjunction() {
        List<RuleNode> rules = List.of(Rules.minLength(5), Rules.containsCharacter('!'), Rules.or());
        for (RuleNode left : rules) {
            for (RuleNode right : rules) {
                for (String input : INPUTS) {
                    boolean expected = RuleVerifier.verify(left, input) && RuleVerifier.verify(right, input);
                    assertEquals(expected, RuleVerifier.verify(Rules.and(left, right), input));
                }
            }
        }
    }

    @Test
    void testOrCombinesChildrenWithDisjunction() {
        List<RuleNode> rules = List.of(Rules.minLength(5), Rules.containsCharacter('!'), Rules.and());
        for (RuleNode left : rules) {
            for (RuleNode right : rules) {
                for (String input : INPUTS) {
                    boolean expected = RuleVerifier.verify(left, input) || RuleVerifier.verify(right, input);
                    assertEquals(expected, RuleVerifier.verify(Rules.or(left, right), input));
                }
            }
        }
    }

    @Test
    void testLengthAndRequiredCharacter() {
        RuleNode tree = Rules.and(Rules.minLength(8), Rules.containsCharacter('@'));

        assertTrue(RuleVerifier.verify(tree, "ab@defgh"));
        assertFalse(RuleVerifier.verify(tree, "short@"));
        assertFalse(RuleVerifier.verify(tree, "abcdefgh"));
    }

    @Test
    void testEitherCharacterOrCharacterSet() {
        RuleNode tree = Rules.or(Rules.containsCharacter('!'), Rules.containsAnyOf("?.,"));

        assertFalse(RuleVerifier.verify(tree, "hello world"));
        assertTrue(RuleVerifier.verify(tree, "hello!"));
        assertTrue(RuleVerifier.verify(tree, "hello, world"));
    }

    @Test
    void testDeeplyNestedTree() {
        RuleNode tree = Rules.and(
            Rules.minLength(8),
            Rules.or(
                Rules.containsCharacter('!'),
                Rules.and(Rules.containsAnyOf("0123456789"), Rules.containsAnyOf("ABC"))
            )
        );

        assertTrue(RuleVerifier.verify(tree, "password!"));
        assertTrue(RuleVerifier.verify(tree, "passwordA1"));
        assertFalse(RuleVerifier.verify(tree, "password1"));
        assertFalse(RuleVerifier.verify(tree, "pass!"));
    }
}
