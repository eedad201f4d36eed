package com.optionseller.util;

public final class ApiConstants {

    private ApiConstants() {
        throw new AssertionError("Cannot instantiate constants class");
    }

    // API Messages
    public static final String MSG_SELL_SCHEDULED = "Order added to queue successfully";
    public static final String MSG_SNAPSHOT_REFRESHED = "Snapshot refreshed";
    public static final String MSG_NO_SNAPSHOT = "No snapshot yet - refresh first";
    public static final String MSG_JOB_NOT_FOUND = "Scheduled sell not found: ";

    // Log Messages
    public static final String LOG_SCHEDULE_REQUEST = "API Request - Schedule sell at price {} for time={} fireAt={}";
    public static final String LOG_SCHEDULE_RESPONSE = "API Response - Sell job {} armed for {}";
    public static final String LOG_GET_JOBS_REQUEST = "API Request - Get scheduled sells";
    public static final String LOG_REFRESH_SNAPSHOT_REQUEST = "API Request - Refresh market snapshot";
}
