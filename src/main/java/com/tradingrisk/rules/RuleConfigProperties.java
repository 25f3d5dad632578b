package com.tradingrisk.rules;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Application properties under {@code risk-assistant.rules}.
 *
 * <p>{@code location} is a Spring resource location ({@code classpath:}, {@code file:}) of the
 * YAML rule file.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "risk-assistant.rules")
public class RuleConfigProperties {

    private String location = "classpath:rules.yml";
}
