package com.algoclock.scheduling;

import com.algoclock.algorithm.SecurityRegistry;
import com.algoclock.calendar.ExchangeHours;
import com.algoclock.domain.model.Security;
import com.algoclock.scheduling.rules.CompositeTimeRule;
import com.algoclock.scheduling.rules.DateRule;
import com.algoclock.scheduling.rules.TimeRule;
import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.stream.Stream;

/**
 * Builds a scheduled event step by step and registers it with the {@link ScheduleManager}:
 * <pre>
 * schedule.event().everyDay("SPY").afterMarketOpen("SPY", 10).run(this::rebalance);
 * </pre>
 *
 * <p>Unless a name is given the event is named {@code "<date rule>: <time rule>"}.
 */
public class FluentScheduledEventBuilder implements FluentDateSpecifier, FluentRunSpecifier {

    private final ScheduleManager schedule;
    private final SecurityRegistry securities;
    private final String name;

    private DateRule dateRule;
    private TimeRule timeRule;
    private Predicate<Instant> predicate;

    public FluentScheduledEventBuilder(ScheduleManager schedule, SecurityRegistry securities, String name) {
        this.schedule = schedule;
        this.securities = securities;
        this.name = name;
    }

    @Override
    public FluentScheduledEventBuilder where(Predicate<Instant> predicate) {
        this.predicate = this.predicate == null ? predicate : this.predicate.and(predicate);
        return this;
    }

    // ---- Dates ----

    @Override
    public FluentTimeSpecifier on(int year, int month, int day) {
        return setDateRule(schedule.getDateRules().on(year, month, day));
    }

    @Override
    public FluentTimeSpecifier on(LocalDate... dates) {
        return setDateRule(schedule.getDateRules().on(dates));
    }

    @Override
    public FluentTimeSpecifier every(DayOfWeek... days) {
        return setDateRule(schedule.getDateRules().every(days));
    }

    @Override
    public FluentTimeSpecifier everyDay() {
        return setDateRule(schedule.getDateRules().everyDay());
    }

    @Override
    public FluentTimeSpecifier everyDay(String symbol) {
        return setDateRule(schedule.getDateRules().everyDay(symbol));
    }

    @Override
    public FluentTimeSpecifier monthStart() {
        return setDateRule(schedule.getDateRules().monthStart());
    }

    @Override
    public FluentTimeSpecifier monthStart(String symbol) {
        return setDateRule(schedule.getDateRules().monthStart(symbol, 0));
    }

    // ---- Times ----

    @Override
    public FluentRunSpecifier at(int hour, int minute) {
        return addTimeRule(schedule.getTimeRules().at(hour, minute));
    }

    @Override
    public FluentRunSpecifier at(int hour, int minute, int second) {
        return addTimeRule(schedule.getTimeRules().at(hour, minute, second));
    }

    @Override
    public FluentRunSpecifier at(int hour, int minute, ZoneId timeZone) {
        return addTimeRule(schedule.getTimeRules().at(hour, minute, timeZone));
    }

    @Override
    public FluentRunSpecifier at(LocalTime timeOfDay) {
        return addTimeRule(schedule.getTimeRules().at(timeOfDay));
    }

    @Override
    public FluentRunSpecifier at(LocalTime timeOfDay, ZoneId timeZone) {
        return addTimeRule(schedule.getTimeRules().at(timeOfDay, timeZone));
    }

    @Override
    public FluentRunSpecifier every(Duration interval) {
        return addTimeRule(schedule.getTimeRules().every(interval));
    }

    @Override
    public FluentRunSpecifier afterMarketOpen(String symbol, double minutesAfterOpen, boolean extendedMarketOpen) {
        return addTimeRule(schedule.getTimeRules().afterMarketOpen(symbol, minutesAfterOpen, extendedMarketOpen));
    }

    @Override
    public FluentRunSpecifier afterMarketOpen(String symbol, double minutesAfterOpen) {
        return afterMarketOpen(symbol, minutesAfterOpen, false);
    }

    @Override
    public FluentRunSpecifier beforeMarketClose(String symbol, double minutesBeforeClose, boolean extendedMarketClose) {
        return addTimeRule(schedule.getTimeRules().beforeMarketClose(symbol, minutesBeforeClose, extendedMarketClose));
    }

    @Override
    public FluentRunSpecifier beforeMarketClose(String symbol, double minutesBeforeClose) {
        return beforeMarketClose(symbol, minutesBeforeClose, false);
    }

    // ---- Run ----

    @Override
    public FluentRunSpecifier duringMarketHours(String symbol, boolean extendedMarketHours) {
        Security security = securities.get(symbol);
        ExchangeHours exchangeHours = security.getExchangeHours();
        return where(time -> {
            LocalDateTime localTime = LocalDateTime.ofInstant(time, exchangeHours.getTimeZone());
            return exchangeHours.isOpenDuring(localTime, localTime, extendedMarketHours);
        });
    }

    @Override
    public FluentRunSpecifier duringMarketHours(String symbol) {
        return duringMarketHours(symbol, false);
    }

    @Override
    public ScheduledEvent run(Runnable callback) {
        return run((eventName, time) -> callback.run());
    }

    @Override
    public ScheduledEvent run(Consumer<Instant> callback) {
        return run((eventName, time) -> callback.accept(time));
    }

    @Override
    public ScheduledEvent run(ScheduledEventCallback callback) {
        if (dateRule == null || timeRule == null) {
            throw new IllegalStateException("A date rule and a time rule are required before run()");
        }
        String eventName = name != null ? name : dateRule.getName() + ": " + timeRule.getName();
        Stream<Instant> eventTimes = timeRule.createUtcEventTimes(schedule.getDefaultDates(dateRule));
        if (predicate != null) {
            eventTimes = eventTimes.filter(predicate);
        }
        ScheduledEvent scheduledEvent = new ScheduledEvent(eventName, eventTimes.iterator(), callback);
        schedule.add(scheduledEvent);
        return scheduledEvent;
    }

    private FluentScheduledEventBuilder setDateRule(DateRule rule) {
        this.dateRule = rule;
        return this;
    }

    private FluentScheduledEventBuilder addTimeRule(TimeRule rule) {
        if (timeRule == null) {
            timeRule = rule;
        } else if (timeRule instanceof CompositeTimeRule composite) {
            timeRule = composite.with(rule);
        } else {
            timeRule = new CompositeTimeRule(timeRule, rule);
        }
        return this;
    }
}
