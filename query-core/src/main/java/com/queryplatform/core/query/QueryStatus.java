package com.queryplatform.core.query;

public enum QueryStatus {
    IDLE,
    LOADING,
    SUCCESS,
    ERROR
}
