package com.piiguard.config;

/**
 * Fatal startup misconfiguration, such as a missing or wrong-length encryption key.
 *
 * <p>Raised while the application context is built, never per request.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }

    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
