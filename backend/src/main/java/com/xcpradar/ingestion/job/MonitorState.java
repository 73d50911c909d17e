package com.xcpradar.ingestion.job;

public enum MonitorState {
    NOT_STARTED,
    STARTING,
    RUNNING,
    STOPPED
}
