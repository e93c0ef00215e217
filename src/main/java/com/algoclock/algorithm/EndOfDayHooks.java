package com.algoclock.algorithm;

import java.lang.reflect.Method;

/**
 * Detects which end-of-day hooks an {@link Algorithm} implementation overrides.
 *
 * <p>Detection is done once per algorithm instance, before any event is created, so that no
 * scheduled event exists for a hook that would do nothing.
 */
public final class EndOfDayHooks {

    private final boolean algorithmEndOfDay;
    private final boolean securityEndOfDay;

    private EndOfDayHooks(boolean algorithmEndOfDay, boolean securityEndOfDay) {
        this.algorithmEndOfDay = algorithmEndOfDay;
        this.securityEndOfDay = securityEndOfDay;
    }

    public static EndOfDayHooks detect(Algorithm algorithm) {
        Class<? extends Algorithm> type = algorithm.getClass();
        return new EndOfDayHooks(isOverridden(type), isOverridden(type, String.class));
    }

    /** Whether {@link Algorithm#onEndOfDay()} is overridden. */
    public boolean hasAlgorithmEndOfDay() {
        return algorithmEndOfDay;
    }

    /** Whether {@link Algorithm#onEndOfDay(String)} is overridden. */
    public boolean hasSecurityEndOfDay() {
        return securityEndOfDay;
    }

    private static boolean isOverridden(Class<? extends Algorithm> type, Class<?>... parameterTypes) {
        try {
            Method method = type.getMethod("onEndOfDay", parameterTypes);
            return method.getDeclaringClass() != Algorithm.class;
        } catch (NoSuchMethodException e) {
            throw new IllegalStateException("Algorithm contract changed: onEndOfDay not found", e);
        }
    }
}
