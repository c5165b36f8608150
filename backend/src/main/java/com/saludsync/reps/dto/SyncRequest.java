package com.saludsync.reps.dto;

/**
 * Parameters of one synchronization run. At least one of the two files must be present.
 */
public record SyncRequest(Long organizationId,
                          SyncFile facilitiesFile,
                          SyncFile servicesFile,
                          boolean createBackup,
                          boolean forceRecreate,
                          String actingUser) {

    public boolean hasAnyFile() {
        return facilitiesFile != null || servicesFile != null;
    }
}
