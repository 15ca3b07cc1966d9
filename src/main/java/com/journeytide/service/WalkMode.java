package com.journeytide.service;

/**
 * LIVE sends messages, touches profiles and persists. DRY_RUN does none of
 * that and only reports where the walk would go.
 */
public enum WalkMode {
    LIVE,
    DRY_RUN
}
