package com.algoclock.calendar;

import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.ZoneId;
import java.util.EnumSet;
import java.util.Map;
import java.util.Set;
import java.util.stream.Stream;
import lombok.Builder;
import lombok.Getter;

/**
 * Trading hours of one exchange, in exchange-local time.
 *
 * <p>A day is open when it is neither a weekend day nor a full holiday. On an open day the
 * regular session runs [marketOpen, marketClose) and the extended session runs
 * [preMarketOpen, postMarketClose). An early close shortens both sessions to the early close time.
 */
@Getter
@Builder
public class ExchangeHours {

    private final String exchange;
    private final ZoneId timeZone;

    @Builder.Default
    private final LocalTime preMarketOpen = LocalTime.of(4, 0);

    @Builder.Default
    private final LocalTime marketOpen = LocalTime.of(9, 30);

    @Builder.Default
    private final LocalTime marketClose = LocalTime.of(16, 0);

    @Builder.Default
    private final LocalTime postMarketClose = LocalTime.of(20, 0);

    @Builder.Default
    private final Set<DayOfWeek> weekendDays = EnumSet.of(DayOfWeek.SATURDAY, DayOfWeek.SUNDAY);

    @Builder.Default
    private final Set<LocalDate> holidays = Set.of();

    /** Early close time by date. */
    @Builder.Default
    private final Map<LocalDate, LocalTime> earlyCloses = Map.of();

    /** Returns true if the exchange trades on this date. */
    public boolean isDateOpen(LocalDate date) {
        return !weekendDays.contains(date.getDayOfWeek()) && !holidays.contains(date);
    }

    /**
     * Returns true if the exchange is open at the given local time.
     *
     * @param extendedMarketHours include the pre- and post-market sessions
     */
    public boolean isOpen(LocalDateTime localDateTime, boolean extendedMarketHours) {
        LocalDate date = localDateTime.toLocalDate();
        if (!isDateOpen(date)) {
            return false;
        }
        LocalTime time = localDateTime.toLocalTime();
        return !time.isBefore(getOpenTime(extendedMarketHours)) && time.isBefore(getCloseTime(date, extendedMarketHours));
    }

    /** Returns true if the whole interval [start, end] lies within a session. */
    public boolean isOpenDuring(LocalDateTime start, LocalDateTime end, boolean extendedMarketHours) {
        if (!isOpen(start, extendedMarketHours)) {
            return false;
        }
        if (end.equals(start)) {
            return true;
        }
        return end.toLocalDate().equals(start.toLocalDate())
                && !end.toLocalTime().isAfter(getCloseTime(start.toLocalDate(), extendedMarketHours));
    }

    /** Session close on the given open date, taking early closes into account. */
    public LocalTime getCloseTime(LocalDate date, boolean extendedMarketHours) {
        LocalTime earlyClose = earlyCloses.get(date);
        if (earlyClose != null) {
            return earlyClose;
        }
        return extendedMarketHours ? postMarketClose : marketClose;
    }

    public LocalTime getOpenTime(boolean extendedMarketHours) {
        return extendedMarketHours ? preMarketOpen : marketOpen;
    }

    /** First session open on or after {@code date}. */
    public LocalDateTime getNextMarketOpen(LocalDate date, boolean extendedMarketHours) {
        LocalDate openDate = isDateOpen(date) ? date : getNextTradingDay(date);
        return openDate.atTime(getOpenTime(extendedMarketHours));
    }

    /** First session close on or after {@code date}. */
    public LocalDateTime getNextMarketClose(LocalDate date, boolean extendedMarketHours) {
        LocalDate openDate = isDateOpen(date) ? date : getNextTradingDay(date);
        return openDate.atTime(getCloseTime(openDate, extendedMarketHours));
    }

    /** Returns the next trading day after the given date. */
    public LocalDate getNextTradingDay(LocalDate from) {
        LocalDate next = from.plusDays(1);
        while (!isDateOpen(next)) {
            next = next.plusDays(1);
        }
        return next;
    }

    /** Returns the previous trading day before the given date. */
    public LocalDate getPreviousTradingDay(LocalDate from) {
        LocalDate previous = from.minusDays(1);
        while (!isDateOpen(previous)) {
            previous = previous.minusDays(1);
        }
        return previous;
    }

    /** Open dates in [start, end], ascending, lazily. */
    public Stream<LocalDate> eachTradeableDay(LocalDate start, LocalDate end) {
        return start.datesUntil(end.plusDays(1)).filter(this::isDateOpen);
    }
}
