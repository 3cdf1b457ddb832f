package com.gibi.app.service;

public class MemorySampleException extends RuntimeException {

    public MemorySampleException(String message) {
        super(message);
    }

    public MemorySampleException(String message, Throwable cause) {
        super(message, cause);
    }
}
