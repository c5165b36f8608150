package com.saludsync.reps.model;

/** Which REPS export a row came from. RUN is used for errors that belong to the whole run. */
public enum RowKind {
    FACILITIES,
    SERVICES,
    CAPACITY,
    RUN
}
