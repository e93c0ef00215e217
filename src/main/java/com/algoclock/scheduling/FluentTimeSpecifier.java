package com.algoclock.scheduling;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.function.Predicate;

/**
 * Second step of a fluent schedule: which times of each date the event runs at. Specifying more
 * than one time rule runs the event at the union of their times.
 */
public interface FluentTimeSpecifier {

    FluentTimeSpecifier where(Predicate<Instant> predicate);

    FluentRunSpecifier at(int hour, int minute);

    FluentRunSpecifier at(int hour, int minute, int second);

    FluentRunSpecifier at(int hour, int minute, ZoneId timeZone);

    FluentRunSpecifier at(LocalTime timeOfDay);

    FluentRunSpecifier at(LocalTime timeOfDay, ZoneId timeZone);

    FluentRunSpecifier every(Duration interval);

    FluentRunSpecifier afterMarketOpen(String symbol, double minutesAfterOpen, boolean extendedMarketOpen);

    FluentRunSpecifier afterMarketOpen(String symbol, double minutesAfterOpen);

    FluentRunSpecifier beforeMarketClose(String symbol, double minutesBeforeClose, boolean extendedMarketClose);

    FluentRunSpecifier beforeMarketClose(String symbol, double minutesBeforeClose);
}
