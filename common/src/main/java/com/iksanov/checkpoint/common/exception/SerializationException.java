package com.iksanov.checkpoint.common.exception;

public class SerializationException extends CheckpointException {
    public SerializationException(String message) {
        super(message);
    }
    public SerializationException(String message, Throwable cause) {
        super(message, cause);
    }
}
