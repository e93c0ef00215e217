package com.algoclock.config;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Scheduler settings bound from the {@code algoclock.scheduler} prefix.
 *
 * <p>Passed to the schedulers and the schedule manager at construction, so two schedulers in
 * the same process (a live one and a backtest, or two tests) never share logging or timing state.
 */
@Component
@ConfigurationProperties(prefix = "algoclock.scheduler")
public class SchedulerProperties {

    /** Algorithm time zone used by date and time rules without an explicit zone. */
    private String timeZone = "America/New_York";

    /** Default for {@code ScheduledEvent.loggingEnabled} on events registered via the schedule manager. */
    private boolean eventLoggingEnabled = false;

    /** How long before the exchange close per-security end-of-day events fire. */
    private Duration securityEndOfDayDelta = Duration.ofMinutes(10);

    /** How long before midnight the algorithm end-of-day event fires. */
    private Duration algorithmEndOfDayDelta = Duration.ofMinutes(2);

    /** Securities registered at startup: symbol to the name of its exchange calendar. */
    private Map<String, String> securities = new LinkedHashMap<>();

    private Live live = new Live();

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    public boolean isEventLoggingEnabled() {
        return eventLoggingEnabled;
    }

    public void setEventLoggingEnabled(boolean eventLoggingEnabled) {
        this.eventLoggingEnabled = eventLoggingEnabled;
    }

    public Duration getSecurityEndOfDayDelta() {
        return securityEndOfDayDelta;
    }

    public void setSecurityEndOfDayDelta(Duration securityEndOfDayDelta) {
        this.securityEndOfDayDelta = securityEndOfDayDelta;
    }

    public Duration getAlgorithmEndOfDayDelta() {
        return algorithmEndOfDayDelta;
    }

    public void setAlgorithmEndOfDayDelta(Duration algorithmEndOfDayDelta) {
        this.algorithmEndOfDayDelta = algorithmEndOfDayDelta;
    }

    public Map<String, String> getSecurities() {
        return securities;
    }

    public void setSecurities(Map<String, String> securities) {
        this.securities = securities;
    }

    public Live getLive() {
        return live;
    }

    public void setLive(Live live) {
        this.live = live;
    }

    /**
     * Settings of the wall-clock driven scheduler.
     */
    public static class Live {

        /** Time between two samples of the wall clock. */
        private Duration scanInterval = Duration.ofSeconds(1);

        /** Upper bound on how long stopping waits for the sampler thread. */
        private Duration stopTimeout = Duration.ofSeconds(5);

        public Duration getScanInterval() {
            return scanInterval;
        }

        public void setScanInterval(Duration scanInterval) {
            this.scanInterval = scanInterval;
        }

        public Duration getStopTimeout() {
            return stopTimeout;
        }

        public void setStopTimeout(Duration stopTimeout) {
            this.stopTimeout = stopTimeout;
        }
    }
}
