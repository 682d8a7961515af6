package com.juno.core.config;

/**
 * Thrown when run configuration is invalid. Always fatal at run start.
 */
public class JunoConfigurationException extends RuntimeException {
    public JunoConfigurationException(String message) {
        super(message);
    }

    public JunoConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
