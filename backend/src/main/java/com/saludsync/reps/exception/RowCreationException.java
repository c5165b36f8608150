package com.saludsync.reps.exception;

public class RowCreationException extends RuntimeException {
    public RowCreationException(String message) {
        super(message);
    }

    public RowCreationException(String message, Throwable cause) {
        super(message, cause);
    }
}
