package com.algoclock.unit.scheduling.rules;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.algoclock.calendar.ExchangeHours;
import com.algoclock.exception.ResourceNotFoundException;
import com.algoclock.exception.ScheduleConfigurationException;
import com.algoclock.scheduling.ManualClock;
import com.algoclock.scheduling.rules.DateRule;
import com.algoclock.scheduling.rules.DateRules;
import com.algoclock.unit.TestSecurities;
import java.time.DayOfWeek;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class DateRulesTest {

    private static final LocalDate JAN_1 = LocalDate.of(2000, 1, 1);
    private static final LocalDate JAN_4 = LocalDate.of(2000, 1, 4);
    private static final LocalDate DEC_31 = LocalDate.of(2000, 12, 31);

    private DateRules dateRules;
    private ExchangeHours nyse;

    @BeforeEach
    void setUp() {
        // 2000-03-15 10:00 New York
        ManualClock clock = new ManualClock(Instant.parse("2000-03-15T15:00:00Z"));
        dateRules = new DateRules(
                TestSecurities.registryWith(TestSecurities.spy()), TestSecurities.NEW_YORK, clock);
        nyse = TestSecurities.nyse();
    }

    private static List<LocalDate> datesOf(DateRule rule, LocalDate start, LocalDate end) {
        return rule.getDates(start, end).collect(Collectors.toList());
    }

    @Nested
    @DisplayName("Every day")
    class EveryDay {

        @Test
        @DisplayName("Every calendar day of 2000 (leap year)")
        void everyCalendarDay() {
            List<LocalDate> dates = datesOf(dateRules.everyDay(), JAN_1, DEC_31);

            assertThat(dates).hasSize(366);
            assertThat(dates).isSorted();
            assertThat(dateRules.everyDay().getName()).isEqualTo("EveryDay");
        }

        @Test
        @DisplayName("Every tradeable day of SPY in 2000")
        void everyTradeableDay() {
            List<LocalDate> dates = datesOf(dateRules.everyDay("SPY"), JAN_1, DEC_31);

            assertThat(dates).hasSize(252);
            assertThat(dates).allMatch(nyse::isDateOpen);
            assertThat(dates).doesNotContain(LocalDate.of(2000, 7, 4));
            assertThat(dateRules.everyDay("SPY").getName()).isEqualTo("SPY: EveryDay");
        }

        @Test
        @DisplayName("Selected days of the week")
        void everyDayOfWeek() {
            List<LocalDate> dates =
                    datesOf(dateRules.every(DayOfWeek.MONDAY, DayOfWeek.FRIDAY), JAN_1, LocalDate.of(2000, 1, 31));

            assertThat(dates).hasSize(9);
            assertThat(dates).allMatch(date -> date.getDayOfWeek() == DayOfWeek.MONDAY
                    || date.getDayOfWeek() == DayOfWeek.FRIDAY);
        }

        @Test
        @DisplayName("Range bounds are inclusive")
        void inclusiveBounds() {
            assertThat(datesOf(dateRules.everyDay(), JAN_4, JAN_4)).containsExactly(JAN_4);
        }
    }

    @Nested
    @DisplayName("Fixed dates")
    class FixedDates {

        @Test
        @DisplayName("on() yields the given dates sorted and within range")
        void onDates() {
            DateRule rule = dateRules.on(LocalDate.of(2000, 6, 1), LocalDate.of(2000, 2, 1), LocalDate.of(2001, 1, 1));

            assertThat(datesOf(rule, JAN_1, DEC_31))
                    .containsExactly(LocalDate.of(2000, 2, 1), LocalDate.of(2000, 6, 1));
            assertThat(rule.getName()).isEqualTo("2000-02-01,2000-06-01,2001-01-01");
        }

        @Test
        @DisplayName("today() and tomorrow() follow the clock in the algorithm time zone")
        void todayAndTomorrow() {
            assertThat(datesOf(dateRules.today(), JAN_1, DEC_31)).containsExactly(LocalDate.of(2000, 3, 15));
            assertThat(datesOf(dateRules.tomorrow(), JAN_1, DEC_31)).containsExactly(LocalDate.of(2000, 3, 16));
        }
    }

    @Nested
    @DisplayName("Month rules")
    class MonthRules {

        @Test
        @DisplayName("Month start yields the 1st of every month")
        void monthStart() {
            List<LocalDate> dates = datesOf(dateRules.monthStart(), JAN_1, DEC_31);

            assertThat(dates).hasSize(12);
            assertThat(dates).allMatch(date -> date.getDayOfMonth() == 1);
        }

        @Test
        @DisplayName("Month start excludes a 1st before the range start")
        void monthStartFromJan4() {
            assertThat(datesOf(dateRules.monthStart(), JAN_4, DEC_31)).hasSize(11);
        }

        @Test
        @DisplayName("Month start with offset yields the 6th of every month")
        void monthStartWithOffset() {
            List<LocalDate> dates = datesOf(dateRules.monthStart(5), JAN_1, DEC_31);

            assertThat(dates).hasSize(12);
            assertThat(dates).allMatch(date -> date.getDayOfMonth() == 6);
            assertThat(dateRules.monthStart(5).getName()).isEqualTo("MonthStart+5");
        }

        @Test
        @DisplayName("Security month start moves a closed day to the next open day")
        void securityMonthStartWithOffset() {
            List<LocalDate> dates = datesOf(dateRules.monthStart("SPY", 5), JAN_4, DEC_31);

            assertThat(dates).hasSize(12);
            assertThat(dates).allMatch(nyse::isDateOpen);
            assertThat(dates).allMatch(date -> date.getDayOfMonth() >= 6 && date.getDayOfMonth() <= 8);
            // 2000-05-06 is a Saturday
            assertThat(dates).contains(LocalDate.of(2000, 5, 8));
        }

        @Test
        @DisplayName("Security month end moves a closed day to the previous open day")
        void securityMonthEnd() {
            List<LocalDate> dates = datesOf(dateRules.monthEnd("SPY", 0), JAN_1, DEC_31);

            assertThat(dates).hasSize(12);
            assertThat(dates).allMatch(nyse::isDateOpen);
            // 2000-12-31 is a Sunday
            assertThat(dates).contains(LocalDate.of(2000, 12, 29));
            assertThat(dateRules.monthEnd("SPY", 0).getName()).isEqualTo("SPY: MonthEnd");
        }

        @Test
        @DisplayName("Month end offset counts back from the last day")
        void monthEndWithOffset() {
            List<LocalDate> dates = datesOf(dateRules.monthEnd(-1), JAN_1, LocalDate.of(2000, 3, 31));

            assertThat(dates).containsExactly(
                    LocalDate.of(2000, 1, 30), LocalDate.of(2000, 2, 28), LocalDate.of(2000, 3, 30));
        }
    }

    @Nested
    @DisplayName("Week rules")
    class WeekRules {

        @Test
        @DisplayName("Week start yields every Monday")
        void weekStart() {
            List<LocalDate> dates = datesOf(dateRules.weekStart(), JAN_1, DEC_31);

            assertThat(dates).hasSize(52);
            assertThat(dates).allMatch(date -> date.getDayOfWeek() == DayOfWeek.MONDAY);
        }

        @Test
        @DisplayName("Security week start skips the MLK holiday to Tuesday")
        void securityWeekStart() {
            List<LocalDate> dates = datesOf(dateRules.weekStart("SPY", 0), JAN_1, LocalDate.of(2000, 1, 31));

            assertThat(dates).contains(LocalDate.of(2000, 1, 18));
            assertThat(dates).doesNotContain(LocalDate.of(2000, 1, 17));
        }

        @Test
        @DisplayName("Security week end moves Good Friday back to Thursday")
        void securityWeekEnd() {
            List<LocalDate> dates = datesOf(dateRules.weekEnd("SPY", 0), LocalDate.of(2000, 4, 17), LocalDate.of(2000, 4, 23));

            assertThat(dates).containsExactly(LocalDate.of(2000, 4, 20));
            assertThat(dateRules.weekEnd("SPY", -1).getName()).isEqualTo("SPY: WeekEnd-1");
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("Out-of-range offsets are rejected")
        void outOfRangeOffsets() {
            assertThatThrownBy(() -> dateRules.monthStart(16)).isInstanceOf(ScheduleConfigurationException.class);
            assertThatThrownBy(() -> dateRules.monthEnd(1)).isInstanceOf(ScheduleConfigurationException.class);
            assertThatThrownBy(() -> dateRules.weekStart(-2)).isInstanceOf(ScheduleConfigurationException.class);
            assertThatThrownBy(() -> dateRules.weekEnd(2)).isInstanceOf(ScheduleConfigurationException.class);
        }

        @Test
        @DisplayName("Unknown symbol is rejected")
        void unknownSymbol() {
            assertThatThrownBy(() -> dateRules.everyDay("QQQ")).isInstanceOf(ResourceNotFoundException.class);
        }
    }

    @Test
    @DisplayName("Open-ended ranges are evaluated lazily")
    void lazyOverLongRange() {
        LocalDate first = dateRules.everyDay("SPY").getDates(JAN_1, DateRules.END_OF_TIME).findFirst().orElseThrow();

        assertThat(first).isEqualTo(LocalDate.of(2000, 1, 3));
    }
}
