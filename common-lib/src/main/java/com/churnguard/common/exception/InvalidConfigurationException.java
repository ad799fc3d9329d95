package com.churnguard.common.exception;

/** Rejected configuration update; the stored configuration is left untouched. */
public class InvalidConfigurationException extends InterventionEngineException {

    public InvalidConfigurationException(String message) {
        super("config", message);
    }
}
