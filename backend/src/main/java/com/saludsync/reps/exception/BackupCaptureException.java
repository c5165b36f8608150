package com.saludsync.reps.exception;

public class BackupCaptureException extends RuntimeException {
    public BackupCaptureException(String message, Throwable cause) {
        super(message, cause);
    }
}
