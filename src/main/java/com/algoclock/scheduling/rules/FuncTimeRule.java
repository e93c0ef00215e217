package com.algoclock.scheduling.rules;

import java.time.Instant;
import java.time.LocalDate;
import java.util.function.Function;
import java.util.stream.Stream;

/**
 * {@link TimeRule} backed by a function producing the times of a single date. Dates on which the
 * function yields nothing (e.g. the market is closed) contribute no times.
 */
public class FuncTimeRule implements TimeRule {

    private final String name;
    private final Function<LocalDate, Stream<Instant>> timesOfDate;

    public FuncTimeRule(String name, Function<LocalDate, Stream<Instant>> timesOfDate) {
        this.name = name;
        this.timesOfDate = timesOfDate;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Stream<Instant> createUtcEventTimes(Stream<LocalDate> dates) {
        return dates.flatMap(timesOfDate);
    }

    @Override
    public String toString() {
        return name;
    }
}
