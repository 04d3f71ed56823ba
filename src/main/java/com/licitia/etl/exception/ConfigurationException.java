package com.licitia.etl.exception;

/**
 * Rejected input: nothing has been written when this is thrown.
 */
public class ConfigurationException extends RuntimeException {

    public ConfigurationException(String message) {
        super(message);
    }
}
