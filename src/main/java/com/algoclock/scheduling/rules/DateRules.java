package com.algoclock.scheduling.rules;

import com.algoclock.algorithm.SecurityRegistry;
import com.algoclock.calendar.ExchangeHours;
import com.algoclock.exception.ScheduleConfigurationException;
import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Factory for the date rules available to scheduled events.
 *
 * <p>Rules taking a symbol follow that security's exchange calendar: {@code everyDay(symbol)}
 * yields only open days, and a month or week boundary falling on a closed day moves to the next
 * open day (start rules) or the previous open day (end rules).
 */
public class DateRules {

    /** Last date of the ranges used for open-ended schedules. */
    public static final LocalDate END_OF_TIME = LocalDate.of(2050, 12, 31);

    private final SecurityRegistry securities;
    private final ZoneId timeZone;
    private final Clock clock;

    public DateRules(SecurityRegistry securities, ZoneId timeZone, Clock clock) {
        this.securities = securities;
        this.timeZone = timeZone;
        this.clock = clock;
    }

    /** The given date only. */
    public DateRule on(int year, int month, int day) {
        return on(LocalDate.of(year, month, day));
    }

    /** The given dates, sorted. */
    public DateRule on(LocalDate... dates) {
        LocalDate[] sorted = Arrays.stream(dates).distinct().sorted().toArray(LocalDate[]::new);
        String name = Arrays.stream(sorted).map(LocalDate::toString).collect(Collectors.joining(","));
        return new FuncDateRule(name, (start, end) -> Arrays.stream(sorted)
                .filter(date -> !date.isBefore(start) && !date.isAfter(end)));
    }

    /** The current date in the algorithm time zone, evaluated when the dates are requested. */
    public DateRule today() {
        return new FuncDateRule("TodayOnly", (start, end) -> Stream.of(LocalDate.now(clock.withZone(timeZone))));
    }

    public DateRule tomorrow() {
        return new FuncDateRule(
                "TomorrowOnly", (start, end) -> Stream.of(LocalDate.now(clock.withZone(timeZone)).plusDays(1)));
    }

    /** Every occurrence of the given days of the week. */
    public DateRule every(DayOfWeek... days) {
        Set<DayOfWeek> selected = days.length == 0 ? EnumSet.noneOf(DayOfWeek.class) : EnumSet.copyOf(Arrays.asList(days));
        String name = Arrays.stream(days).map(DayOfWeek::name).collect(Collectors.joining(","));
        return new FuncDateRule(name, (start, end) -> eachDay(start, end).filter(date -> selected.contains(date.getDayOfWeek())));
    }

    /** Every calendar day. */
    public DateRule everyDay() {
        return new FuncDateRule("EveryDay", DateRules::eachDay);
    }

    /** Every day the security's exchange is open. */
    public DateRule everyDay(String symbol) {
        ExchangeHours exchangeHours = exchangeHoursOf(symbol);
        return new FuncDateRule(symbol + ": EveryDay", exchangeHours::eachTradeableDay);
    }

    public DateRule monthStart() {
        return monthStart(0);
    }

    /**
     * The first day of each month plus {@code daysOffset}.
     *
     * @param daysOffset between 0 and 15
     */
    public DateRule monthStart(int daysOffset) {
        return monthStart(null, daysOffset);
    }

    /**
     * The first open day of each month plus {@code daysOffset} for the security's exchange.
     *
     * @param symbol null for calendar days
     * @param daysOffset between 0 and 15
     */
    public DateRule monthStart(String symbol, int daysOffset) {
        checkOffset("MonthStart", daysOffset, 0, 15);
        ExchangeHours exchangeHours = symbol == null ? null : exchangeHoursOf(symbol);
        return new FuncDateRule(
                ruleName(symbol, "MonthStart", daysOffset),
                (start, end) -> monthDates(exchangeHours, start, end, daysOffset, true));
    }

    public DateRule monthEnd() {
        return monthEnd(0);
    }

    /**
     * The last day of each month plus {@code daysOffset}.
     *
     * @param daysOffset between -15 and 0
     */
    public DateRule monthEnd(int daysOffset) {
        return monthEnd(null, daysOffset);
    }

    public DateRule monthEnd(String symbol, int daysOffset) {
        checkOffset("MonthEnd", daysOffset, -15, 0);
        ExchangeHours exchangeHours = symbol == null ? null : exchangeHoursOf(symbol);
        return new FuncDateRule(
                ruleName(symbol, "MonthEnd", daysOffset),
                (start, end) -> monthDates(exchangeHours, start, end, daysOffset, false));
    }

    public DateRule weekStart() {
        return weekStart(0);
    }

    /**
     * Monday of each week plus {@code daysOffset}.
     *
     * @param daysOffset between -1 and 5
     */
    public DateRule weekStart(int daysOffset) {
        return weekStart(null, daysOffset);
    }

    public DateRule weekStart(String symbol, int daysOffset) {
        checkOffset("WeekStart", daysOffset, -1, 5);
        ExchangeHours exchangeHours = symbol == null ? null : exchangeHoursOf(symbol);
        return new FuncDateRule(
                ruleName(symbol, "WeekStart", daysOffset),
                (start, end) -> weekDates(exchangeHours, start, end, daysOffset, true));
    }

    public DateRule weekEnd() {
        return weekEnd(0);
    }

    /**
     * Friday of each week plus {@code daysOffset}.
     *
     * @param daysOffset between -5 and 1
     */
    public DateRule weekEnd(int daysOffset) {
        return weekEnd(null, daysOffset);
    }

    public DateRule weekEnd(String symbol, int daysOffset) {
        checkOffset("WeekEnd", daysOffset, -5, 1);
        ExchangeHours exchangeHours = symbol == null ? null : exchangeHoursOf(symbol);
        return new FuncDateRule(
                ruleName(symbol, "WeekEnd", daysOffset),
                (start, end) -> weekDates(exchangeHours, start, end, daysOffset, false));
    }

    /** Every calendar day in [start, end]. */
    public static Stream<LocalDate> eachDay(LocalDate start, LocalDate end) {
        return start.datesUntil(end.plusDays(1));
    }

    private static Stream<LocalDate> monthDates(
            ExchangeHours exchangeHours, LocalDate start, LocalDate end, int offset, boolean searchForward) {
        // Month start: the 1st + offset. Month end: the last day of the month + offset.
        return eachDay(start, end)
                .filter(date -> date.getDayOfMonth() == (searchForward ? 1 : date.lengthOfMonth()) + offset)
                .map(date -> toOpenDate(exchangeHours, date, searchForward));
    }

    private static Stream<LocalDate> weekDates(
            ExchangeHours exchangeHours, LocalDate start, LocalDate end, int offset, boolean searchForward) {
        // Week start: Monday + offset. Week end: Friday + offset.
        DayOfWeek scheduledDay = (searchForward ? DayOfWeek.MONDAY : DayOfWeek.FRIDAY).plus(offset);
        return eachDay(start, end)
                .filter(date -> date.getDayOfWeek() == scheduledDay)
                .map(date -> toOpenDate(exchangeHours, date, searchForward));
    }

    private static LocalDate toOpenDate(ExchangeHours exchangeHours, LocalDate date, boolean searchForward) {
        if (exchangeHours == null) {
            return date;
        }
        LocalDate current = date;
        while (!exchangeHours.isDateOpen(current)) {
            current = searchForward ? current.plusDays(1) : current.minusDays(1);
        }
        return current;
    }

    private ExchangeHours exchangeHoursOf(String symbol) {
        return securities.get(symbol).getExchangeHours();
    }

    private static void checkOffset(String ruleType, int daysOffset, int min, int max) {
        if (daysOffset < min || daysOffset > max) {
            throw new ScheduleConfigurationException(
                    String.format("DateRules.%s(): offset must be between %d and %d", ruleType, min, max),
                    Map.of("daysOffset", daysOffset));
        }
    }

    private static String ruleName(String symbol, String ruleType, int offset) {
        String offsetString = offset == 0 ? "" : String.format("%+d", offset);
        return symbol == null ? ruleType + offsetString : symbol + ": " + ruleType + offsetString;
    }
}
