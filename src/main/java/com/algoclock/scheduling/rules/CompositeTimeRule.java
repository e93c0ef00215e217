package com.algoclock.scheduling.rules;

import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.PriorityQueue;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Union of several time rules. Each rule's ascending sequence is merged lazily with the others,
 * so the result stays ascending even when rules in different time zones put the times of one
 * date on either side of another date's. Nested composites are flattened.
 */
public class CompositeTimeRule implements TimeRule {

    private final List<TimeRule> rules;
    private final String name;

    public CompositeTimeRule(TimeRule... rules) {
        this(List.of(rules));
    }

    public CompositeTimeRule(List<TimeRule> rules) {
        List<TimeRule> flattened = new ArrayList<>();
        for (TimeRule rule : rules) {
            if (rule instanceof CompositeTimeRule composite) {
                flattened.addAll(composite.getRules());
            } else {
                flattened.add(rule);
            }
        }
        this.rules = Collections.unmodifiableList(flattened);
        this.name = flattened.stream().map(TimeRule::getName).collect(Collectors.joining(","));
    }

    public List<TimeRule> getRules() {
        return rules;
    }

    /** Returns a composite holding this composite's rules followed by {@code rule}. */
    public CompositeTimeRule with(TimeRule rule) {
        List<TimeRule> combined = new ArrayList<>(rules);
        combined.add(rule);
        return new CompositeTimeRule(combined);
    }

    @Override
    public String getName() {
        return name;
    }

    @Override
    public Stream<Instant> createUtcEventTimes(Stream<LocalDate> dates) {
        if (rules.size() == 1) {
            return rules.get(0).createUtcEventTimes(dates);
        }
        SharedDates sharedDates = new SharedDates(dates.iterator());
        List<Iterator<Instant>> sources = new ArrayList<>(rules.size());
        for (TimeRule rule : rules) {
            sources.add(rule.createUtcEventTimes(sharedDates.newReader()).iterator());
        }
        Iterator<Instant> merged = new MergingIterator(sources);
        return StreamSupport.stream(
                Spliterators.spliteratorUnknownSize(merged, Spliterator.ORDERED | Spliterator.NONNULL), false);
    }

    @Override
    public String toString() {
        return name;
    }

    /** K-way merge of ascending iterators; ties keep rule order. */
    private static final class MergingIterator implements Iterator<Instant> {

        private final PriorityQueue<Head> heads = new PriorityQueue<>(
                Comparator.comparing((Head head) -> head.time).thenComparingInt(head -> head.source));
        private final List<Iterator<Instant>> sources;

        private MergingIterator(List<Iterator<Instant>> sources) {
            this.sources = sources;
            for (int i = 0; i < sources.size(); i++) {
                advance(i);
            }
        }

        @Override
        public boolean hasNext() {
            return !heads.isEmpty();
        }

        @Override
        public Instant next() {
            Head head = heads.poll();
            if (head == null) {
                throw new NoSuchElementException();
            }
            advance(head.source);
            return head.time;
        }

        private void advance(int source) {
            Iterator<Instant> iterator = sources.get(source);
            if (iterator.hasNext()) {
                heads.add(new Head(iterator.next(), source));
            }
        }
    }

    private static final class Head {

        private final Instant time;
        private final int source;

        private Head(Instant time, int source) {
            this.time = time;
            this.source = source;
        }
    }

    /**
     * Lets each rule read the same date sequence at its own pace. Dates are pulled from the
     * source on demand and dropped once every reader has passed them.
     */
    private static final class SharedDates {

        private final Iterator<LocalDate> source;
        private final Deque<LocalDate> buffer = new ArrayDeque<>();
        private final List<long[]> positions = new ArrayList<>();
        private long bufferStart;

        private SharedDates(Iterator<LocalDate> source) {
            this.source = source;
        }

        private Stream<LocalDate> newReader() {
            long[] position = {bufferStart};
            positions.add(position);
            Iterator<LocalDate> reader = new Iterator<>() {
                @Override
                public boolean hasNext() {
                    return position[0] < bufferStart + buffer.size() || source.hasNext();
                }

                @Override
                public LocalDate next() {
                    if (position[0] == bufferStart + buffer.size()) {
                        buffer.addLast(source.next());
                    }
                    LocalDate date = get(position[0]);
                    position[0]++;
                    trim();
                    return date;
                }
            };
            return StreamSupport.stream(
                    Spliterators.spliteratorUnknownSize(reader, Spliterator.ORDERED | Spliterator.NONNULL), false);
        }

        private LocalDate get(long position) {
            long offset = position - bufferStart;
            if (offset == 0) {
                return buffer.getFirst();
            }
            if (offset == buffer.size() - 1) {
                return buffer.getLast();
            }
            Iterator<LocalDate> iterator = buffer.iterator();
            for (long i = 0; i < offset; i++) {
                iterator.next();
            }
            return iterator.next();
        }

        private void trim() {
            long slowest = Long.MAX_VALUE;
            for (long[] position : positions) {
                slowest = Math.min(slowest, position[0]);
            }
            while (bufferStart < slowest && !buffer.isEmpty()) {
                buffer.removeFirst();
                bufferStart++;
            }
        }
    }
}
