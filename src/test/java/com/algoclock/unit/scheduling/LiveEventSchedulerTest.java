package com.algoclock.unit.scheduling;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.same;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

import com.algoclock.observability.SchedulerMetrics;
import com.algoclock.scheduling.LiveEventScheduler;
import com.algoclock.scheduling.ManualClock;
import com.algoclock.scheduling.ScheduledEvent;
import com.algoclock.scheduling.ScheduledEventErrorHandler;
import com.algoclock.scheduling.SchedulerMode;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for LiveEventScheduler covering the sampler lifecycle, error isolation and
 * concurrent registration while the sampler is scanning.
 */
class LiveEventSchedulerTest {

    private static final Instant T0 = Instant.parse("2024-06-03T13:30:00Z");

    private ManualClock clock;
    private ScheduledEventErrorHandler errorHandler;
    private SchedulerMetrics schedulerMetrics;
    private LiveEventScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new ManualClock(T0);
        errorHandler = mock(ScheduledEventErrorHandler.class);
        schedulerMetrics = SchedulerMetrics.inMemory();
        scheduler = newScheduler(Duration.ofMillis(10), Duration.ofSeconds(2));
    }

    @AfterEach
    void tearDown() {
        scheduler.stop();
    }

    private LiveEventScheduler newScheduler(Duration scanInterval, Duration stopTimeout) {
        return new LiveEventScheduler(clock, scanInterval, stopTimeout, errorHandler, schedulerMetrics);
    }

    @Test
    @DisplayName("Non-positive scan interval is rejected")
    void rejectsNonPositiveInterval() {
        assertThatThrownBy(() -> newScheduler(Duration.ZERO, Duration.ofSeconds(1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Nested
    @DisplayName("Sampler")
    class Sampler {

        @Test
        @DisplayName("Fires an event once the clock reaches its time")
        void firesWhenClockReachesTime() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicReference<Instant> triggerTime = new AtomicReference<>();
            scheduler.add(new ScheduledEvent("e", T0.plusSeconds(60), (n, t) -> {
                triggerTime.set(t);
                latch.countDown();
            }));

            scheduler.start();
            Thread.sleep(50);
            assertThat(latch.getCount()).isEqualTo(1);

            clock.advance(Duration.ofSeconds(60));

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(triggerTime.get()).isEqualTo(T0.plusSeconds(60));
        }

        @Test
        @DisplayName("start() is idempotent and reports running")
        void startIsIdempotent() {
            scheduler.start();
            scheduler.start();

            assertThat(scheduler.isRunning()).isTrue();
        }

        @Test
        @DisplayName("stop() returns promptly even with a long scan interval")
        void stopIsPrompt() {
            LiveEventScheduler slow = newScheduler(Duration.ofMinutes(10), Duration.ofSeconds(5));
            slow.start();

            long startNanos = System.nanoTime();
            slow.stop();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);

            assertThat(slow.isRunning()).isFalse();
            assertThat(elapsedMillis).isLessThan(2_000);
        }

        @Test
        @DisplayName("No event fires after stop()")
        void noFiringAfterStop() throws InterruptedException {
            AtomicInteger fired = new AtomicInteger();
            scheduler.add(new ScheduledEvent("e", T0.plusSeconds(60), (n, t) -> fired.incrementAndGet()));
            scheduler.start();
            scheduler.stop();

            clock.advance(Duration.ofSeconds(120));
            Thread.sleep(100);

            assertThat(fired.get()).isZero();
        }

        @Test
        @DisplayName("A callback can stop the scheduler, and events later in the same scan do not fire")
        void stopFromCallback() throws InterruptedException {
            CountDownLatch latch = new CountDownLatch(1);
            AtomicInteger firedAfterStop = new AtomicInteger();
            scheduler.add(new ScheduledEvent("stopper", T0, (n, t) -> {
                scheduler.stop();
                latch.countDown();
            }));
            scheduler.add(new ScheduledEvent("next", T0, (n, t) -> firedAfterStop.incrementAndGet()));

            scheduler.start();

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            // takes the queue lock, so the scan has finished
            assertThat(scheduler.getNextEventUtcTime()).isEqualTo(T0);
            assertThat(firedAfterStop.get()).isZero();
            assertThat(scheduler.isRunning()).isFalse();
        }

        @Test
        @DisplayName("stop() gives up on a blocked callback after the stop timeout")
        void stopTimesOutOnBlockedCallback() throws InterruptedException {
            LiveEventScheduler blocking = newScheduler(Duration.ofMillis(10), Duration.ofMillis(200));
            CountDownLatch entered = new CountDownLatch(1);
            CountDownLatch release = new CountDownLatch(1);
            blocking.add(new ScheduledEvent("blocked", T0, (n, t) -> {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            }));
            blocking.start();
            assertThat(entered.await(2, TimeUnit.SECONDS)).isTrue();

            long startNanos = System.nanoTime();
            blocking.stop();
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            release.countDown();

            assertThat(elapsedMillis).isBetween(150L, 2_000L);
            assertThat(blocking.isRunning()).isFalse();
        }
    }

    @Nested
    @DisplayName("Error isolation")
    class ErrorIsolation {

        @Test
        @DisplayName("A failing callback is reported and the next event still fires")
        void failingCallbackDoesNotStopScan() {
            IllegalStateException failure = new IllegalStateException("boom");
            List<String> fired = new ArrayList<>();
            ScheduledEvent bad = new ScheduledEvent("bad", T0, (n, t) -> {
                throw failure;
            });
            scheduler.add(bad);
            scheduler.add(new ScheduledEvent("good", T0, (n, t) -> fired.add(n)));

            scheduler.setTime(T0);

            assertThat(fired).containsExactly("good");
            verify(errorHandler).handleError(same(bad), eq(T0), same(failure));
        }

        @Test
        @DisplayName("An AssertionError from a callback is reported and the sampler keeps firing")
        void assertionErrorIsIsolated() throws InterruptedException {
            AssertionError failure = new AssertionError("boom");
            CountDownLatch latch = new CountDownLatch(1);
            ScheduledEvent bad = new ScheduledEvent("bad", T0, (n, t) -> {
                throw failure;
            });
            scheduler.add(bad);
            scheduler.add(new ScheduledEvent("later", T0.plusSeconds(1), (n, t) -> latch.countDown()));

            scheduler.start();
            Thread.sleep(50);
            clock.advance(Duration.ofSeconds(1));

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.isRunning()).isTrue();
            verify(errorHandler).handleError(same(bad), eq(T0), same(failure));
        }

        @Test
        @DisplayName("Occurrences fired before a failing one are counted")
        void partialFiringsCounted() {
            AtomicInteger calls = new AtomicInteger();
            scheduler.add(new ScheduledEvent(
                    "flaky", List.of(T0.minusSeconds(2), T0.minusSeconds(1), T0), (n, t) -> {
                        if (calls.incrementAndGet() == 3) {
                            throw new IllegalStateException("third");
                        }
                    }));

            scheduler.setTime(T0);

            assertThat(calls.get()).isEqualTo(3);
            assertThat(schedulerMetrics.getFiredCount(SchedulerMode.LIVE)).isEqualTo(2.0);
        }

        @Test
        @DisplayName("Sampler keeps running after a callback and its error handler both fail")
        void samplerSurvivesFailures() throws InterruptedException {
            doThrow(new IllegalStateException("handler down"))
                    .when(errorHandler)
                    .handleError(any(), any(), any());
            CountDownLatch latch = new CountDownLatch(1);
            scheduler.add(new ScheduledEvent("bad", T0, (n, t) -> {
                throw new IllegalStateException("boom");
            }));
            scheduler.add(new ScheduledEvent("later", T0.plusSeconds(1), (n, t) -> latch.countDown()));

            scheduler.start();
            Thread.sleep(50);
            clock.advance(Duration.ofSeconds(1));

            assertThat(latch.await(2, TimeUnit.SECONDS)).isTrue();
            assertThat(scheduler.isRunning()).isTrue();
        }
    }

    @Nested
    @DisplayName("Concurrency")
    class Concurrency {

        @Test
        @DisplayName("Concurrent add/remove against repeated scans leaves the net membership")
        void concurrentAddRemove() throws InterruptedException {
            int iterations = 100_000;
            AtomicBoolean done = new AtomicBoolean(false);
            AtomicReference<Throwable> samplerError = new AtomicReference<>();
            AtomicInteger fired = new AtomicInteger();

            Thread sampler = new Thread(() -> {
                try {
                    while (!done.get()) {
                        scheduler.setTime(T0);
                    }
                } catch (Throwable t) {
                    samplerError.set(t);
                }
            });
            sampler.start();

            List<ScheduledEvent> kept = new ArrayList<>();
            for (int i = 0; i < iterations; i++) {
                ScheduledEvent event = new ScheduledEvent("event-" + i, T0, (n, t) -> fired.incrementAndGet());
                scheduler.add(event);
                if (i % 2 == 1) {
                    scheduler.remove(event);
                } else {
                    kept.add(event);
                }
            }
            done.set(true);
            sampler.join(10_000);

            assertThat(samplerError.get()).isNull();
            assertThat(scheduler.size()).isEqualTo(kept.size());
            assertThat(scheduler.getScheduledEvents()).containsExactlyInAnyOrderElementsOf(kept);

            // every remaining event fires exactly once in total
            scheduler.setTime(T0);
            assertThat(kept).allMatch(ScheduledEvent::isExhausted);
            assertThat(fired.get()).isBetween(kept.size(), iterations);
        }
    }

    @Test
    @DisplayName("Exposes next event time and live mode")
    void exposesState() {
        assertThat(scheduler.getNextEventUtcTime()).isEqualTo(ScheduledEvent.END_OF_TIME);

        scheduler.add(new ScheduledEvent("e", T0.plusSeconds(5), (n, t) -> {}));

        assertThat(scheduler.getNextEventUtcTime()).isEqualTo(T0.plusSeconds(5));
        assertThat(scheduler.getMode()).isEqualTo(SchedulerMode.LIVE);
        assertThat(scheduler.getScanInterval()).isEqualTo(Duration.ofMillis(10));
    }
}
