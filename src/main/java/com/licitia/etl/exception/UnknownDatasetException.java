package com.licitia.etl.exception;

public class UnknownDatasetException extends ConfigurationException {

    public UnknownDatasetException(String dataset, String subset) {
        super(subset == null
                ? "Unknown dataset: " + dataset
                : "Unknown dataset/subset: " + dataset + "/" + subset);
    }
}
