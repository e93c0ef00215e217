package com.algoclock.algorithm;

import java.time.ZoneId;

/**
 * The parts of a trading algorithm the scheduling layer interacts with.
 *
 * <p>The end-of-day hooks are optional: an implementation that does not override one of them
 * gets no end-of-day event for it (see {@link EndOfDayHooks}).
 */
public interface Algorithm {

    String getName();

    /** Time zone the algorithm's dates and times of day are expressed in. */
    ZoneId getTimeZone();

    SecurityRegistry getSecurities();

    /** Called shortly before midnight on each day any subscribed exchange was open. */
    default void onEndOfDay() {}

    /** Called shortly before the close of each trading day of {@code symbol}. */
    default void onEndOfDay(String symbol) {}
}
