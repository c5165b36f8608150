package com.saludsync.reps.exception;

public class SyncInProgressException extends RuntimeException {
    public SyncInProgressException(Long organizationId) {
        super("A synchronization is already running for organization " + organizationId);
    }
}
