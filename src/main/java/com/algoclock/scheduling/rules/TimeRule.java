package com.algoclock.scheduling.rules;

import java.time.Instant;
import java.time.LocalDate;
import java.util.stream.Stream;

/**
 * Turns the dates produced by a {@link DateRule} into UTC firing times.
 */
public interface TimeRule {

    String getName();

    /** Firing times for the given ascending dates, ascending. */
    Stream<Instant> createUtcEventTimes(Stream<LocalDate> dates);
}
