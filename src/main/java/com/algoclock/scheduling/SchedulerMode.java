package com.algoclock.scheduling;

/**
 * The two ways an {@link EventScheduler} is driven.
 *
 * <p>BACKTEST fails fast on callback errors, LIVE logs them and keeps scanning.
 */
public enum SchedulerMode {

    /** Time advanced synchronously by the simulation loop. */
    BACKTEST("backtest"),

    /** Time sampled from the wall clock by a background thread. */
    LIVE("live");

    private final String tag;

    SchedulerMode(String tag) {
        this.tag = tag;
    }

    /** Lower-case name used as a metric tag. */
    public String getTag() {
        return tag;
    }
}
