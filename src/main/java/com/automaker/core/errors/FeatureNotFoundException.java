package com.automaker.core.errors;

public class FeatureNotFoundException extends RuntimeException {

    public FeatureNotFoundException(String featureId) {
        super("Feature " + featureId + " not found");
    }
}
