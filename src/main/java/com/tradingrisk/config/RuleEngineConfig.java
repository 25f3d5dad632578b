package com.tradingrisk.config;

import com.tradingrisk.rules.RuleConfig;
import com.tradingrisk.rules.RuleConfigLoader;
import com.tradingrisk.rules.RuleConfigProperties;
import java.time.Clock;
import java.util.Random;
import java.util.random.RandomGenerator;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Provides the shared {@link RuleConfig} bean plus the clock and random source used by the
 * decision pipeline and the coach.
 *
 * <p>The rule file is read exactly once here; a missing or invalid file fails context startup.
 */
@Configuration
@EnableConfigurationProperties(RuleConfigProperties.class)
public class RuleEngineConfig {

    @Bean
    public RuleConfig ruleConfig(RuleConfigLoader ruleConfigLoader, RuleConfigProperties ruleConfigProperties) {
        return ruleConfigLoader.load(ruleConfigProperties.getLocation());
    }

    @Bean
    public Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public RandomGenerator coachRandom() {
        return new Random();
    }
}
