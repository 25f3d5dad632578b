package com.tradingrisk.unit;

import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import com.tradingrisk.rules.RuleConfig;
import com.tradingrisk.rules.RuleConfigLoader;
import com.tradingrisk.rules.RuleDocument;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.HashMap;
import java.util.Map;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * Rule sets for unit tests.
 *
 * <p>{@code rules-test.yml} is shaped so that the "passing" answers below score 80 / 75 / 90
 * per category (weights 40 / 30 / 30), giving a final score of 81.5.
 */
public final class RuleConfigFixtures {

    private static final RuleConfigLoader LOADER = new RuleConfigLoader(new DefaultResourceLoader());
    private static final YAMLMapper YAML = new YAMLMapper();

    private RuleConfigFixtures() {}

    public static RuleConfig standard() {
        return LOADER.load("classpath:rules-test.yml");
    }

    public static RuleConfig fromYaml(String yaml) {
        try {
            return LOADER.build(new RuleDocument(YAML.readTree(yaml), "inline"));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /** Answers that pass every hard stop and score 80 / 75 / 90. */
    public static Map<String, Object> passingAnswers() {
        Map<String, Object> answers = new HashMap<>();
        answers.put("sleep_quality", 7);
        answers.put("mental_state", 8);
        answers.put("clear_bias", true);
        answers.put("volatility", 3);
        answers.put("trend_alignment", true);
        answers.put("risk_reward", 3);
        return answers;
    }
}
