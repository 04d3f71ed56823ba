package com.licitia.etl.exception;

public class InvalidFrequencyException extends ConfigurationException {

    public InvalidFrequencyException(String value) {
        super("Unknown frequency '" + value + "' (expected Mensual, Trimestral or Anual)");
    }
}
