package com.algoclock.scheduling;

import java.time.Instant;

/**
 * Callback invoked each time a {@link ScheduledEvent} fires.
 *
 * <p>Receives the event name and the time the occurrence was scheduled for, which is
 * never later than the scan time and may be earlier when the scheduler is catching up.
 */
@FunctionalInterface
public interface ScheduledEventCallback {

    void onEvent(String name, Instant triggerTime);
}
