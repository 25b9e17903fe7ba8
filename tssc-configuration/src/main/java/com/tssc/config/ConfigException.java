package com.tssc.config;

/**
 * Thrown when a pipeline definition is malformed or two definitions conflict (e.g. the same global
 * default given different values by two sources). Raised while parsing, before any step runs.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
