package com.algoclock.scheduling;

import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.function.Predicate;

/**
 * First step of a fluent schedule: which dates the event runs on.
 */
public interface FluentDateSpecifier {

    /** Keeps only the event times matching {@code predicate}. */
    FluentTimeSpecifier where(Predicate<Instant> predicate);

    FluentTimeSpecifier on(int year, int month, int day);

    FluentTimeSpecifier on(LocalDate... dates);

    FluentTimeSpecifier every(DayOfWeek... days);

    FluentTimeSpecifier everyDay();

    FluentTimeSpecifier everyDay(String symbol);

    FluentTimeSpecifier monthStart();

    FluentTimeSpecifier monthStart(String symbol);
}
