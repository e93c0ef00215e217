package com.algoclock.scheduling.rules;

import java.time.LocalDate;
import java.util.function.BiFunction;
import java.util.stream.Stream;

/**
 * {@link DateRule} backed by a function of the requested range.
 */
public class FuncDateRule implements DateRule {

    private final String name;
    private final BiFunction<LocalDate, LocalDate, Stream<LocalDate>> getDatesFunction;

    public FuncDateRule(String name, BiFunction<LocalDate, LocalDate, Stream<LocalDate>> getDatesFunction) {
        this.name = name;
        this.getDatesFunction = getDatesFunction;
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Stream<LocalDate> getDates(LocalDate start, LocalDate end) {
        return getDatesFunction.apply(start, end);
    }

    @Override
    public String toString() {
        return name;
    }
}
