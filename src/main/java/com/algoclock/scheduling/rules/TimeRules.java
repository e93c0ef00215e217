package com.algoclock.scheduling.rules;

import com.algoclock.algorithm.SecurityRegistry;
import com.algoclock.calendar.ExchangeHours;
import com.algoclock.exception.ScheduleConfigurationException;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Factory for the time rules available to scheduled events.
 *
 * <p>Times of day without an explicit zone are in the algorithm time zone. Market-relative rules
 * use the security's exchange calendar and zone, and yield nothing on days the exchange is closed.
 */
public class TimeRules {

    private final SecurityRegistry securities;
    private final ZoneId timeZone;

    public TimeRules(SecurityRegistry securities, ZoneId timeZone) {
        this.securities = securities;
        this.timeZone = timeZone;
    }

    public TimeRule at(int hour, int minute) {
        return at(LocalTime.of(hour, minute));
    }

    public TimeRule at(int hour, int minute, int second) {
        return at(LocalTime.of(hour, minute, second));
    }

    public TimeRule at(LocalTime timeOfDay) {
        return new FuncTimeRule(timeOfDay.toString(), date -> Stream.of(toUtc(date, timeOfDay, timeZone)));
    }

    public TimeRule at(int hour, int minute, ZoneId zone) {
        return at(LocalTime.of(hour, minute), zone);
    }

    public TimeRule at(LocalTime timeOfDay, ZoneId zone) {
        return new FuncTimeRule(timeOfDay + " " + zone.getId(), date -> Stream.of(toUtc(date, timeOfDay, zone)));
    }

    public TimeRule midnight() {
        return new FuncTimeRule("Midnight", date -> Stream.of(toUtc(date, LocalTime.MIDNIGHT, timeZone)));
    }

    public TimeRule noon() {
        return new FuncTimeRule("Noon", date -> Stream.of(toUtc(date, LocalTime.NOON, timeZone)));
    }

    /**
     * Every {@code interval} from midnight of each date until the next midnight, in the algorithm
     * time zone. Stepping happens on the time line, so daylight saving transitions neither repeat
     * nor skip a step.
     */
    public TimeRule every(Duration interval) {
        if (interval.isZero() || interval.isNegative()) {
            throw new ScheduleConfigurationException(
                    "TimeRules.every(): interval must be positive", Map.of("interval", interval.toString()));
        }
        return new FuncTimeRule("Every " + formatMinutes(interval) + " min", date -> {
            Instant dayStart = date.atStartOfDay(timeZone).toInstant();
            Instant nextDayStart = date.plusDays(1).atStartOfDay(timeZone).toInstant();
            return Stream.iterate(dayStart, time -> time.isBefore(nextDayStart), time -> time.plus(interval));
        });
    }

    /**
     * The given number of minutes after the security's market open.
     *
     * @param extendedMarketOpen measure from the pre-market open instead of the regular open
     */
    public TimeRule afterMarketOpen(String symbol, double minutesAfterOpen, boolean extendedMarketOpen) {
        ExchangeHours exchangeHours = securities.get(symbol).getExchangeHours();
        Duration offset = toDuration(minutesAfterOpen);
        String name = String.format("%s: %s min after MarketOpen", symbol, formatMinutes(offset));
        return new FuncTimeRule(name, date -> {
            if (!exchangeHours.isDateOpen(date)) {
                return Stream.empty();
            }
            LocalTime open = exchangeHours.getOpenTime(extendedMarketOpen);
            return Stream.of(date.atTime(open).plus(offset).atZone(exchangeHours.getTimeZone()).toInstant());
        });
    }

    public TimeRule afterMarketOpen(String symbol, double minutesAfterOpen) {
        return afterMarketOpen(symbol, minutesAfterOpen, false);
    }

    /**
     * The given number of minutes before the security's market close, early closes included.
     *
     * @param extendedMarketClose measure from the post-market close instead of the regular close
     */
    public TimeRule beforeMarketClose(String symbol, double minutesBeforeClose, boolean extendedMarketClose) {
        ExchangeHours exchangeHours = securities.get(symbol).getExchangeHours();
        Duration offset = toDuration(minutesBeforeClose);
        String name = String.format("%s: %s min before MarketClose", symbol, formatMinutes(offset));
        return new FuncTimeRule(name, date -> {
            if (!exchangeHours.isDateOpen(date)) {
                return Stream.empty();
            }
            LocalTime close = exchangeHours.getCloseTime(date, extendedMarketClose);
            return Stream.of(date.atTime(close).minus(offset).atZone(exchangeHours.getTimeZone()).toInstant());
        });
    }

    public TimeRule beforeMarketClose(String symbol, double minutesBeforeClose) {
        return beforeMarketClose(symbol, minutesBeforeClose, false);
    }

    private static Instant toUtc(LocalDate date, LocalTime timeOfDay, ZoneId zone) {
        return date.atTime(timeOfDay).atZone(zone).toInstant();
    }

    private static Duration toDuration(double minutes) {
        if (minutes < 0) {
            throw new ScheduleConfigurationException("Minutes offset must not be negative", Map.of("minutes", minutes));
        }
        return Duration.ofMillis(Math.round(minutes * 60_000));
    }

    private static String formatMinutes(Duration duration) {
        long millis = duration.toMillis();
        if (millis % 60_000 == 0) {
            return Long.toString(millis / 60_000);
        }
        return String.format(Locale.ROOT, "%.2f", millis / 60_000.0);
    }
}
