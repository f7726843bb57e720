package io.caretaker.core.config;

/**
 * Invalid or missing configuration. Raised during startup, before the scheduler loop runs.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
