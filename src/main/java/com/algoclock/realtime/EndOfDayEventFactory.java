package com.algoclock.realtime;

import com.algoclock.algorithm.Algorithm;
import com.algoclock.calendar.ExchangeHours;
import com.algoclock.config.SchedulerProperties;
import com.algoclock.domain.model.Security;
import com.algoclock.exception.ScheduleConfigurationException;
import com.algoclock.scheduling.ScheduledEvent;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Creates the end-of-day events the engine registers on behalf of an algorithm.
 *
 * <ul>
 *   <li><b>Algorithm.EndOfDay</b>: {@code algorithmEndOfDayDelta} before midnight in the
 *       algorithm time zone, on every date at least one of the algorithm's exchanges is open</li>
 *   <li><b>&lt;symbol&gt;.EndOfDay</b>: {@code securityEndOfDayDelta} before the security's
 *       session close, early closes included, on every date its exchange is open</li>
 * </ul>
 *
 * <p>Callback exceptions are not caught here. The scheduler running the event applies its own
 * policy: a backtest fails, a live run logs and continues.
 */
@Component
public class EndOfDayEventFactory {

    private static final Logger log = LoggerFactory.getLogger(EndOfDayEventFactory.class);

    private static final Duration ONE_DAY = Duration.ofDays(1);

    private final Duration algorithmEndOfDayDelta;
    private final Duration securityEndOfDayDelta;

    public EndOfDayEventFactory(SchedulerProperties schedulerProperties) {
        this(schedulerProperties.getAlgorithmEndOfDayDelta(), schedulerProperties.getSecurityEndOfDayDelta());
    }

    public EndOfDayEventFactory(Duration algorithmEndOfDayDelta, Duration securityEndOfDayDelta) {
        this.algorithmEndOfDayDelta = checkDelta(algorithmEndOfDayDelta, "algorithmEndOfDayDelta");
        this.securityEndOfDayDelta = checkDelta(securityEndOfDayDelta, "securityEndOfDayDelta");
    }

    /**
     * Event calling {@link Algorithm#onEndOfDay()} shortly before midnight of each trading date in
     * [start, end]. Trading dates are those of the securities registered when this is called.
     *
     * @param currentUtcTime when not null, occurrences at or before this instant are dropped
     */
    public ScheduledEvent everyAlgorithmEndOfDay(
            Algorithm algorithm, LocalDate start, LocalDate end, Instant currentUtcTime) {
        List<ExchangeHours> exchanges = algorithm.getSecurities().getAll().stream()
                .map(Security::getExchangeHours)
                .distinct()
                .toList();
        Stream<LocalDate> tradingDates = start.datesUntil(end.plusDays(1))
                .filter(date -> exchanges.stream().anyMatch(exchange -> exchange.isDateOpen(date)));

        return ScheduledEvent.everyDayAt(
                ScheduledEvent.createEventName("Algorithm", "EndOfDay"),
                tradingDates,
                ONE_DAY.minus(algorithmEndOfDayDelta),
                algorithm.getTimeZone(),
                (name, triggerTime) -> {
                    log.debug("ScheduledEvent.{}: Firing at {}", name, triggerTime);
                    algorithm.onEndOfDay();
                },
                currentUtcTime);
    }

    /**
     * Event calling {@link Algorithm#onEndOfDay(String)} shortly before each session close of the
     * security in [start, end].
     *
     * @param currentUtcTime when not null, occurrences at or before this instant are dropped
     */
    public ScheduledEvent everySecurityEndOfDay(
            Algorithm algorithm, Security security, LocalDate start, LocalDate end, Instant currentUtcTime) {
        ExchangeHours exchangeHours = security.getExchangeHours();
        String symbol = security.getSymbol();

        Stream<Instant> eventTimes = exchangeHours.eachTradeableDay(start, end)
                .map(date -> exchangeHours.getNextMarketClose(date, security.isExtendedMarketHours()))
                .map(marketClose -> toUtc(marketClose.minus(securityEndOfDayDelta), exchangeHours));

        return new ScheduledEvent(
                ScheduledEvent.createEventName(symbol, "EndOfDay"),
                afterCurrentTime(eventTimes, currentUtcTime).iterator(),
                (name, triggerTime) -> algorithm.onEndOfDay(symbol));
    }

    public Duration getAlgorithmEndOfDayDelta() {
        return algorithmEndOfDayDelta;
    }

    public Duration getSecurityEndOfDayDelta() {
        return securityEndOfDayDelta;
    }

    private static Instant toUtc(LocalDateTime localDateTime, ExchangeHours exchangeHours) {
        return localDateTime.atZone(exchangeHours.getTimeZone()).toInstant();
    }

    private static Stream<Instant> afterCurrentTime(Stream<Instant> eventTimes, Instant currentUtcTime) {
        return currentUtcTime == null ? eventTimes : eventTimes.filter(time -> time.isAfter(currentUtcTime));
    }

    private static Duration checkDelta(Duration delta, String name) {
        if (delta.compareTo(ONE_DAY) >= 0) {
            throw new ScheduleConfigurationException(
                    "End of day delta must be less than a day", Map.of(name, delta.toString()));
        }
        return delta;
    }
}
