package com.algoclock.calendar;

/**
 * Classifies a non-regular day on an exchange calendar.
 *
 * <p>FULL_HOLIDAY means no trading at all. EARLY_CLOSE is a trading day whose session ends at the
 * holiday's configured close time instead of the regular close.
 */
public enum HolidayType {

    /** Exchange closed all day. */
    FULL_HOLIDAY,

    /** Shortened session, e.g. the day after Thanksgiving. */
    EARLY_CLOSE
}
