package com.algoclock.scheduling;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Ordered collection of scheduled events, shared by both scheduler variants.
 *
 * <p>Entries are ordered by two keys:
 * <ol>
 *   <li>Next event time: earliest first, exhausted events last</li>
 *   <li>Insertion sequence: events sharing a time fire in the order they were added</li>
 * </ol>
 *
 * <p>A scan visits only the leading run of due entries, so a tick where nothing is due costs a
 * single comparison. Only the visited run changes its keys, so only that run is re-sorted and then
 * merged back into the untouched tail; the whole collection is never re-sorted.
 *
 * <p>Membership is by identity: the same instance can be registered once, while distinct
 * instances sharing a name are independent entries.
 *
 * <p>Cost model:
 * <ul>
 *   <li>membership checks are O(1) through an identity map</li>
 *   <li>{@link #add} and {@link #remove} outside a scan binary-search the sorted list, then shift
 *       it, which is O(n) in the worst case but a single array copy</li>
 *   <li>during a scan both are O(1): a tombstone or a buffered addition</li>
 * </ul>
 * Registrations change at universe updates, far less often than the scheduler ticks, so the
 * shift is traded for a tick that costs one comparison when nothing is due.
 *
 * <p>Mutation from inside a visitor is supported: removals tombstone the entry so it is skipped
 * and purged when the scan completes, additions are buffered and inserted after the scan.
 *
 * <p>Not thread-safe. {@link LiveEventScheduler} guards it with a lock.
 */
class ScheduledEventQueue {

    private static final Comparator<Entry> ORDER = Comparator.comparing((Entry entry) -> entry.event.getNextEventUtcTime())
            .thenComparingLong(entry -> entry.sequence);

    /** Sorted by {@link #ORDER} whenever no scan is in progress. */
    private final List<Entry> entries = new ArrayList<>();

    private final Map<ScheduledEvent, Entry> index = new IdentityHashMap<>();
    private final List<Entry> pendingAdds = new ArrayList<>();

    private long sequenceCounter;
    private boolean scanning;

    /**
     * Registers an event.
     *
     * @return false if this instance is already registered
     */
    boolean add(ScheduledEvent event) {
        if (index.containsKey(event)) {
            return false;
        }
        Entry entry = new Entry(event, ++sequenceCounter);
        index.put(event, entry);
        if (scanning) {
            pendingAdds.add(entry);
        } else {
            insertSorted(entry);
        }
        return true;
    }

    /**
     * Unregisters an event. Unknown events are ignored.
     *
     * @return false if the event was not registered
     */
    boolean remove(ScheduledEvent event) {
        Entry entry = index.remove(event);
        if (entry == null) {
            return false;
        }
        entry.removed = true;
        if (!scanning) {
            int position = Collections.binarySearch(entries, entry, ORDER);
            if (position >= 0) {
                entries.remove(position);
            } else {
                // key changed outside a scan, fall back to a linear search
                entries.remove(entry);
            }
        }
        return true;
    }

    boolean contains(ScheduledEvent event) {
        return index.containsKey(event);
    }

    int size() {
        return index.size();
    }

    /** Earliest next event time among registered events, or {@link ScheduledEvent#END_OF_TIME}. */
    Instant peekNextEventUtcTime() {
        for (Entry entry : entries) {
            if (!entry.removed) {
                return entry.event.getNextEventUtcTime();
            }
        }
        return ScheduledEvent.END_OF_TIME;
    }

    /** Registered events in firing order. */
    List<ScheduledEvent> snapshot() {
        List<ScheduledEvent> events = new ArrayList<>(index.size());
        for (Entry entry : entries) {
            if (!entry.removed) {
                events.add(entry.event);
            }
        }
        for (Entry entry : pendingAdds) {
            if (!entry.removed) {
                events.add(entry.event);
            }
        }
        return events;
    }

    /**
     * Hands every event due at {@code utcTime} to {@code visitor}, in queue order.
     *
     * <p>If the visitor throws, the entries visited so far (including the failing one) are
     * re-ordered before the exception propagates; the rest remain untouched.
     *
     * @return the number of events visited
     */
    int scan(Instant utcTime, Consumer<ScheduledEvent> visitor) {
        if (scanning) {
            throw new IllegalStateException("Scan already in progress");
        }
        scanning = true;
        int visited = 0;
        try {
            while (visited < entries.size()) {
                Entry entry = entries.get(visited);
                if (entry.event.getNextEventUtcTime().isAfter(utcTime)) {
                    break;
                }
                visited++;
                if (!entry.removed) {
                    visitor.accept(entry.event);
                }
            }
            return visited;
        } finally {
            scanning = false;
            restoreOrder(visited);
        }
    }

    /**
     * Re-sorts the first {@code visited} entries, merges them with the sorted tail, drops
     * tombstones, and inserts additions buffered during the scan.
     */
    private void restoreOrder(int visited) {
        if (visited > 0 || hasTombstones()) {
            List<Entry> head = new ArrayList<>(visited);
            for (Entry entry : entries.subList(0, visited)) {
                if (!entry.removed) {
                    head.add(entry);
                }
            }
            head.sort(ORDER);

            List<Entry> merged = new ArrayList<>(entries.size());
            int h = 0;
            for (Entry entry : entries.subList(visited, entries.size())) {
                if (entry.removed) {
                    continue;
                }
                while (h < head.size() && ORDER.compare(head.get(h), entry) < 0) {
                    merged.add(head.get(h++));
                }
                merged.add(entry);
            }
            while (h < head.size()) {
                merged.add(head.get(h++));
            }

            entries.clear();
            entries.addAll(merged);
        }

        if (!pendingAdds.isEmpty()) {
            List<Entry> additions = new ArrayList<>(pendingAdds);
            pendingAdds.clear();
            for (Entry entry : additions) {
                if (!entry.removed) {
                    insertSorted(entry);
                }
            }
        }
    }

    private boolean hasTombstones() {
        return entries.size() + pendingAdds.size() != index.size();
    }

    private void insertSorted(Entry entry) {
        int position = Collections.binarySearch(entries, entry, ORDER);
        entries.add(position < 0 ? -position - 1 : position, entry);
    }

    private static final class Entry {

        private final ScheduledEvent event;
        private final long sequence;
        private boolean removed;

        private Entry(ScheduledEvent event, long sequence) {
            this.event = event;
            this.sequence = sequence;
        }
    }
}
