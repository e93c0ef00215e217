package com.algoclock.calendar;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.stereotype.Component;

/**
 * Exchange calendars loaded from application.yml via the {@code algoclock.calendar} prefix.
 *
 * <p>Each exchange declares its time zone, its session boundaries in exchange-local time and its
 * holidays. Sessions open and close on the same local day. The holiday lists are maintained by hand
 * from the exchanges' published calendars.
 */
@Component
@ConfigurationProperties(prefix = "algoclock.calendar")
public class ExchangeCalendarConfig {

    private List<Exchange> exchanges = new ArrayList<>();

    public List<Exchange> getExchanges() {
        return exchanges;
    }

    public void setExchanges(List<Exchange> exchanges) {
        this.exchanges = exchanges;
    }

    /**
     * Session times and holidays of one exchange.
     */
    public static class Exchange {

        private String name;
        private String timezone = "America/New_York";
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime preMarketOpen = LocalTime.of(4, 0);
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime marketOpen = LocalTime.of(9, 30);
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime marketClose = LocalTime.of(16, 0);
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime postMarketClose = LocalTime.of(20, 0);
        private List<Holiday> holidays = new ArrayList<>();

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public String getTimezone() {
            return timezone;
        }

        public void setTimezone(String timezone) {
            this.timezone = timezone;
        }

        public LocalTime getPreMarketOpen() {
            return preMarketOpen;
        }

        public void setPreMarketOpen(LocalTime preMarketOpen) {
            this.preMarketOpen = preMarketOpen;
        }

        public LocalTime getMarketOpen() {
            return marketOpen;
        }

        public void setMarketOpen(LocalTime marketOpen) {
            this.marketOpen = marketOpen;
        }

        public LocalTime getMarketClose() {
            return marketClose;
        }

        public void setMarketClose(LocalTime marketClose) {
            this.marketClose = marketClose;
        }

        public LocalTime getPostMarketClose() {
            return postMarketClose;
        }

        public void setPostMarketClose(LocalTime postMarketClose) {
            this.postMarketClose = postMarketClose;
        }

        public List<Holiday> getHolidays() {
            return holidays;
        }

        public void setHolidays(List<Holiday> holidays) {
            this.holidays = holidays;
        }
    }

    /**
     * A single holiday entry on an exchange calendar. {@code closeTime} only applies to
     * {@link HolidayType#EARLY_CLOSE}.
     */
    public static class Holiday {

        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE)
        private LocalDate date;
        private String name;
        private HolidayType type = HolidayType.FULL_HOLIDAY;
        @DateTimeFormat(pattern = "HH:mm")
        private LocalTime closeTime;

        public LocalDate getDate() {
            return date;
        }

        public void setDate(LocalDate date) {
            this.date = date;
        }

        public String getName() {
            return name;
        }

        public void setName(String name) {
            this.name = name;
        }

        public HolidayType getType() {
            return type;
        }

        public void setType(HolidayType type) {
            this.type = type;
        }

        public LocalTime getCloseTime() {
            return closeTime;
        }

        public void setCloseTime(LocalTime closeTime) {
            this.closeTime = closeTime;
        }
    }
}
