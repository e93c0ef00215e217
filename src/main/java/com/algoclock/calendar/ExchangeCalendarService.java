package com.algoclock.calendar;

import com.algoclock.exception.ResourceNotFoundException;
import com.algoclock.exception.ScheduleConfigurationException;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Builds {@link ExchangeHours} for every exchange declared in {@link ExchangeCalendarConfig}.
 *
 * <p>Calendars are built once at startup. A configuration with an unknown time zone, a session
 * closing before it opens, or an early close without a close time is rejected at that point rather
 * than when the first event is scheduled.
 */
@Service
public class ExchangeCalendarService {

    private static final Logger log = LoggerFactory.getLogger(ExchangeCalendarService.class);

    private final Map<String, ExchangeHours> exchangeHours;

    public ExchangeCalendarService(ExchangeCalendarConfig exchangeCalendarConfig) {
        Map<String, ExchangeHours> built = new LinkedHashMap<>();
        for (ExchangeCalendarConfig.Exchange exchange : exchangeCalendarConfig.getExchanges()) {
            built.put(exchange.getName(), toExchangeHours(exchange));
        }
        this.exchangeHours = Collections.unmodifiableMap(built);
        log.info("Loaded exchange calendars: {}", exchangeHours.keySet());
    }

    /**
     * Returns the hours of the named exchange.
     *
     * @throws ResourceNotFoundException if no calendar is configured for it
     */
    public ExchangeHours getExchangeHours(String exchange) {
        ExchangeHours hours = exchangeHours.get(exchange);
        if (hours == null) {
            throw new ResourceNotFoundException("Exchange calendar", exchange);
        }
        return hours;
    }

    public Collection<ExchangeHours> getAllExchangeHours() {
        return exchangeHours.values();
    }

    private ExchangeHours toExchangeHours(ExchangeCalendarConfig.Exchange exchange) {
        if (exchange.getName() == null || exchange.getName().isBlank()) {
            throw new ScheduleConfigurationException("Exchange calendar entry without a name");
        }
        if (!exchange.getMarketOpen().isBefore(exchange.getMarketClose())
                || exchange.getPreMarketOpen().isAfter(exchange.getMarketOpen())
                || exchange.getPostMarketClose().isBefore(exchange.getMarketClose())) {
            throw new ScheduleConfigurationException(
                    "Invalid session times for exchange " + exchange.getName(),
                    Map.of(
                            "preMarketOpen", exchange.getPreMarketOpen().toString(),
                            "marketOpen", exchange.getMarketOpen().toString(),
                            "marketClose", exchange.getMarketClose().toString(),
                            "postMarketClose", exchange.getPostMarketClose().toString()));
        }

        Set<LocalDate> holidays = new HashSet<>();
        Map<LocalDate, LocalTime> earlyCloses = new HashMap<>();
        for (ExchangeCalendarConfig.Holiday holiday : exchange.getHolidays()) {
            if (holiday.getType() == HolidayType.EARLY_CLOSE) {
                if (holiday.getCloseTime() == null) {
                    throw new ScheduleConfigurationException(
                            "Early close without close time on " + holiday.getDate() + " for exchange " + exchange.getName());
                }
                earlyCloses.put(holiday.getDate(), holiday.getCloseTime());
            } else {
                holidays.add(holiday.getDate());
            }
        }

        ZoneId timeZone;
        try {
            timeZone = ZoneId.of(exchange.getTimezone());
        } catch (DateTimeException e) {
            throw new ScheduleConfigurationException(
                    "Unknown time zone " + exchange.getTimezone() + " for exchange " + exchange.getName(), e);
        }

        return ExchangeHours.builder()
                .exchange(exchange.getName())
                .timeZone(timeZone)
                .preMarketOpen(exchange.getPreMarketOpen())
                .marketOpen(exchange.getMarketOpen())
                .marketClose(exchange.getMarketClose())
                .postMarketClose(exchange.getPostMarketClose())
                .holidays(Set.copyOf(holidays))
                .earlyCloses(Map.copyOf(earlyCloses))
                .build();
    }
}
