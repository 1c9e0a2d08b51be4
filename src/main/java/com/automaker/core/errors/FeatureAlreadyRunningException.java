package com.automaker.core.errors;

public class FeatureAlreadyRunningException extends RuntimeException {

    public FeatureAlreadyRunningException(String featureId) {
        super("already running: feature " + featureId + " has an active execution");
    }
}
