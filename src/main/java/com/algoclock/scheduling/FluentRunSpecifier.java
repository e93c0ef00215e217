package com.algoclock.scheduling;

import java.time.Instant;
import java.util.function.Consumer;
import java.util.function.Predicate;

/**
 * Last step of a fluent schedule: filters and the callback. {@code run} registers the event.
 */
public interface FluentRunSpecifier extends FluentTimeSpecifier {

    @Override
    FluentRunSpecifier where(Predicate<Instant> predicate);

    /** Keeps only the event times at which the security's exchange is open. */
    FluentRunSpecifier duringMarketHours(String symbol, boolean extendedMarketHours);

    FluentRunSpecifier duringMarketHours(String symbol);

    ScheduledEvent run(Runnable callback);

    ScheduledEvent run(Consumer<Instant> callback);

    ScheduledEvent run(ScheduledEventCallback callback);
}
