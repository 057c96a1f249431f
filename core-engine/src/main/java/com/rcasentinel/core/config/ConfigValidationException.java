package com.rcasentinel.core.config;

/**
 * Thrown when a configuration update is rejected because a value is outside
 * its legal range. The active configuration is left unchanged.
 *
 * @since 1.0.0
 */
public class ConfigValidationException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public ConfigValidationException(String message) {
        super(message);
    }
}
