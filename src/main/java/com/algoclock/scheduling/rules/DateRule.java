package com.algoclock.scheduling.rules;

import java.time.LocalDate;
import java.util.stream.Stream;

/**
 * Generates the dates a scheduled event fires on.
 */
public interface DateRule {

    /** Readable name, used to build default event names. */
    String getName();

    /**
     * Dates in [start, end] selected by this rule, ascending. The stream is lazy, so an
     * effectively unbounded range costs nothing until consumed.
     */
    Stream<LocalDate> getDates(LocalDate start, LocalDate end);
}
