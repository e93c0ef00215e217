package com.algoclock.unit.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.algoclock.scheduling.ScheduledEvent;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class ScheduledEventTest {

    private static final Instant T0 = Instant.parse("2024-03-01T14:30:00Z");

    @Nested
    @DisplayName("Cursor")
    class Cursor {

        @Test
        @DisplayName("Next time is primed on construction")
        void nextTimePrimedOnConstruction() {
            ScheduledEvent event = new ScheduledEvent("e", List.of(T0, T0.plusSeconds(60)), (n, t) -> {});

            assertThat(event.getNextEventUtcTime()).isEqualTo(T0);
            assertThat(event.isExhausted()).isFalse();
        }

        @Test
        @DisplayName("Empty sequence is exhausted immediately")
        void emptySequenceIsExhausted() {
            ScheduledEvent event = new ScheduledEvent("e", List.of(), (n, t) -> {});

            assertThat(event.isExhausted()).isTrue();
            assertThat(event.getNextEventUtcTime()).isEqualTo(ScheduledEvent.END_OF_TIME);
        }

        @Test
        @DisplayName("Infinite sequence is consumed lazily")
        void infiniteSequenceIsLazy() {
            AtomicInteger generated = new AtomicInteger();
            Stream<Instant> everyMinute = Stream.iterate(T0, t -> {
                generated.incrementAndGet();
                return t.plusSeconds(60);
            });
            ScheduledEvent event = new ScheduledEvent("e", everyMinute.iterator(), (n, t) -> {});

            event.scan(T0.plusSeconds(120));

            assertThat(event.getNextEventUtcTime()).isEqualTo(T0.plusSeconds(180));
            assertThat(generated.get()).isLessThanOrEqualTo(4);
        }
    }

    @Nested
    @DisplayName("Scan")
    class Scan {

        @Test
        @DisplayName("Does not fire before the scheduled time, fires at it")
        void firesAtScheduledTime() {
            List<Instant> fired = new ArrayList<>();
            ScheduledEvent event = new ScheduledEvent("e", T0, (n, t) -> fired.add(t));

            assertThat(event.scan(T0.minusMillis(1))).isZero();
            assertThat(event.scan(T0)).isEqualTo(1);

            assertThat(fired).containsExactly(T0);
            assertThat(event.isExhausted()).isTrue();
        }

        @Test
        @DisplayName("Fires every due occurrence oldest first with the scheduled time")
        void catchUpPassesScheduledTimes() {
            List<Instant> fired = new ArrayList<>();
            List<Instant> times = List.of(T0, T0.plusSeconds(60), T0.plusSeconds(120));
            ScheduledEvent event = new ScheduledEvent("e", times, (n, t) -> fired.add(t));

            int count = event.scan(T0.plus(Duration.ofHours(1)));

            assertThat(count).isEqualTo(3);
            assertThat(fired).containsExactlyElementsOf(times);
        }

        @Test
        @DisplayName("Callback receives the event name")
        void callbackReceivesName() {
            List<String> names = new ArrayList<>();
            ScheduledEvent event = new ScheduledEvent("Algorithm.EndOfDay", T0, (n, t) -> names.add(n));

            event.scan(T0);

            assertThat(names).containsExactly("Algorithm.EndOfDay");
        }

        @Test
        @DisplayName("Exhausted event never fires again")
        void exhaustedEventIsInert() {
            AtomicInteger fired = new AtomicInteger();
            ScheduledEvent event = new ScheduledEvent("e", T0, (n, t) -> fired.incrementAndGet());

            event.scan(T0);
            event.scan(T0.plusSeconds(3600));
            event.scan(Instant.parse("2099-01-01T00:00:00Z"));

            assertThat(fired.get()).isEqualTo(1);
        }

        @Test
        @DisplayName("Cursor moves past a failing occurrence, later ones stay pending")
        void failingCallbackAdvancesCursor() {
            List<Instant> fired = new ArrayList<>();
            ScheduledEvent event = new ScheduledEvent("e", List.of(T0, T0.plusSeconds(60)), (n, t) -> {
                if (t.equals(T0)) {
                    throw new IllegalStateException("boom");
                }
                fired.add(t);
            });

            assertThatThrownBy(() -> event.scan(T0.plusSeconds(60))).isInstanceOf(IllegalStateException.class);
            assertThat(event.getNextEventUtcTime()).isEqualTo(T0.plusSeconds(60));

            event.scan(T0.plusSeconds(60));
            assertThat(fired).containsExactly(T0.plusSeconds(60));
        }
    }

    @Nested
    @DisplayName("Skipping")
    class Skipping {

        @Test
        @DisplayName("Skips occurrences strictly before the given time without firing")
        void skipsPastOccurrences() {
            AtomicInteger fired = new AtomicInteger();
            ScheduledEvent event = new ScheduledEvent(
                    "e", List.of(T0, T0.plusSeconds(60), T0.plusSeconds(120)), (n, t) -> fired.incrementAndGet());

            int skipped = event.skipEventsUntil(T0.plusSeconds(60));

            assertThat(skipped).isEqualTo(1);
            assertThat(event.getNextEventUtcTime()).isEqualTo(T0.plusSeconds(60));
            assertThat(fired.get()).isZero();
        }

        @Test
        @DisplayName("Logging flag does not change firing")
        void loggingDoesNotChangeFiring() {
            AtomicInteger fired = new AtomicInteger();
            ScheduledEvent event = new ScheduledEvent("e", List.of(T0, T0.plusSeconds(60)), (n, t) -> fired.incrementAndGet());
            event.setLoggingEnabled(true);

            event.skipEventsUntil(T0.plusSeconds(1));
            event.scan(T0.plusSeconds(60));

            assertThat(event.isLoggingEnabled()).isTrue();
            assertThat(fired.get()).isEqualTo(1);
            assertThat(event.isExhausted()).isTrue();
        }
    }

    @Nested
    @DisplayName("everyDayAt")
    class EveryDayAt {

        private final ZoneId newYork = ZoneId.of("America/New_York");

        @Test
        @DisplayName("Fires at the time of day in the given zone across a DST change")
        void timeOfDayInZone() {
            Stream<LocalDate> dates = Stream.of(LocalDate.of(2024, 3, 8), LocalDate.of(2024, 3, 11));

            ScheduledEvent event = ScheduledEvent.everyDayAt(
                    "Daily", dates, Duration.ofHours(12), newYork, (n, t) -> {}, null);

            assertThat(event.getNextEventUtcTime()).isEqualTo(Instant.parse("2024-03-08T17:00:00Z"));
            event.scan(Instant.parse("2024-03-08T17:00:00Z"));
            assertThat(event.getNextEventUtcTime()).isEqualTo(Instant.parse("2024-03-11T16:00:00Z"));
        }

        @Test
        @DisplayName("Drops occurrences at or before the current time")
        void dropsPastOccurrences() {
            Stream<LocalDate> dates = Stream.of(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4));

            ScheduledEvent event = ScheduledEvent.everyDayAt(
                    "Daily", dates, Duration.ofHours(9).plusMinutes(30), newYork, (n, t) -> {}, T0);

            assertThat(event.getNextEventUtcTime()).isEqualTo(Instant.parse("2024-03-04T14:30:00Z"));
        }

        @Test
        @DisplayName("Consumes an unbounded date stream lazily")
        void lazyDates() {
            Stream<LocalDate> dates = Stream.iterate(LocalDate.of(2024, 1, 1), date -> date.plusDays(1));

            ScheduledEvent event = ScheduledEvent.everyDayAt(
                    "Daily", dates, Duration.ZERO, ZoneId.of("UTC"), (n, t) -> {}, null);
            event.scan(Instant.parse("2024-01-10T00:00:00Z"));

            assertThat(event.getNextEventUtcTime()).isEqualTo(Instant.parse("2024-01-11T00:00:00Z"));
        }
    }

    @Test
    @DisplayName("Event names are scoped with a dot")
    void createEventName() {
        assertThat(ScheduledEvent.createEventName("SPY", "EndOfDay")).isEqualTo("SPY.EndOfDay");
    }

    @Test
    @DisplayName("toString shows the next time or never")
    void toStringShowsNextTime() {
        ScheduledEvent event = new ScheduledEvent("e", T0, (n, t) -> {});
        assertThat(event.toString()).isEqualTo("e (next: 2024-03-01T14:30:00Z)");

        event.scan(T0);
        assertThat(event.toString()).isEqualTo("e (next: never)");
    }
}
