package com.platform.tripcleaning.config;

/**
 * Missing or invalid pipeline input or settings. Fatal at startup.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
