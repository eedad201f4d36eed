package com.optionseller.model;

public enum ExecutionEventType {
    ARMED,
    REFRESH_STARTED,
    SNAPSHOT_BUILT,
    QUOTES_FETCHED,
    MATCH_FOUND,
    NO_MATCH,
    NEAR_MATCH,
    ORDER_PLACED,
    ORDER_FAILED,
    COMPLETED,
    FAILED
}
