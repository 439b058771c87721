package com.iksanov.checkpoint.common.exception;

public class ConfigurationException extends CheckpointException {
    public ConfigurationException(String message) {
        super(message);
    }
    public ConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
