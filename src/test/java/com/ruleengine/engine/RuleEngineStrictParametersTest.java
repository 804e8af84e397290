package com.ruleengine.engine;

import com.ruleengine.common.exception.InvalidRuleParameterException;
import com.ruleengine.rules.Rules;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration tests for the rule engine with parameter validation switched on.
 */
@SpringBootTest(properties = "rule-engine.strict-parameters=true")
@ActiveProfiles("test")
class RuleEngineStrictParametersTest {

    @Autowired
    private RuleEngine ruleEngine;

    @Test
    void testValidTreeIsEvaluated() {
        assertTrue(ruleEngine.evaluate(Rules.and(Rules.minLength(0), Rules.containsAnyOf("!")), "!"));
    }

    @Test
    void testInvalidParametersAreRejected() {
        InvalidRuleParameterException e = assertThrows(InvalidRuleParameterException.class,
            () -> ruleEngine.evaluate(Rules.or(Rules.minLength(-1), Rules.containsAnyOf("")), "x"));

        assertEquals(List.of(
            "Minimum length must not be negative: -1",
            "Character set must not be empty"
        ), e.getViolations());
        assertTrue(e.getMessage().startsWith("Invalid rule parameters: "));
    }

    @Test
    void testDescribeIsAlsoValidated() {
        assertThrows(InvalidRuleParameterException.class, () -> ruleEngine.describe(Rules.containsAnyOf("")));
    }
}
