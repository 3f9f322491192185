package com.davisodom.townsim.config;

/**
 * Configuration could not be read or failed validation. Fatal at startup.
 */
public class ConfigException extends RuntimeException {

    public ConfigException(String message) {
        super(message);
    }

    public ConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
