package com.tradingrisk.exception;

/**
 * Thrown when the rule configuration cannot be located, parsed, or is missing a required key.
 *
 * <p>Raised while the application context starts; the engine cannot run without a valid
 * rule set, so this is never caught inside the decision path.
 */
public class ConfigurationException extends BaseException {

    public ConfigurationException(String message) {
        super(ErrorCode.CONFIGURATION_ERROR, message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(ErrorCode.CONFIGURATION_ERROR, message, cause);
    }
}
