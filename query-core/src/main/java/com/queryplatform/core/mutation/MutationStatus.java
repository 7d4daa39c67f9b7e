package com.queryplatform.core.mutation;

public enum MutationStatus {
    IDLE,
    LOADING,
    SUCCESS,
    ERROR,
    /** Stored in the offline queue for replay on reconnect. */
    QUEUED
}
