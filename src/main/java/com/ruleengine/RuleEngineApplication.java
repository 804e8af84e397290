package com.ruleengine;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the Rule Engine.
 *
 * Rule Engine evaluates string inputs against composable rule trees
 * (length thresholds, required characters, AND/OR composition) and renders
 * those trees as human-readable requirement descriptions.
 */
@SpringBootApplication
public class RuleEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(RuleEngineApplication.class, args);
    }
}
