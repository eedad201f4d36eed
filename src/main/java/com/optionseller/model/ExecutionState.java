package com.optionseller.model;

/**
 * Lifecycle of a scheduled sell job.
 */
public enum ExecutionState {
    /**
     * Timer armed, waiting for the fire instant
     */
    ARMED,

    /**
     * Fetching the reference price and rebuilding the snapshot
     */
    REFRESHING,

    /**
     * Fetching option quotes and matching them against the target price
     */
    MATCHING,

    /**
     * Placing the two sell orders
     */
    EXECUTING,

    /**
     * No pair matched; listing pairs with similar prices instead
     */
    REPORTING_NO_MATCH,

    DONE,

    ERROR
}
