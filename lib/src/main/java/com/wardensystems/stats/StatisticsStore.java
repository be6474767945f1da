package com.wardensystems.stats;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Table of per-service counters and heartbeat timestamps shared by every service and the health monitor.
 *
 * <p>One lock guards the whole table. Every operation, including read-modify-write increments, runs as a
 * single critical section, so concurrent writers never lose updates. Nothing is persisted; a new store
 * starts empty.</p>
 */
public class StatisticsStore {

    private static final Logger logger = LoggerFactory.getLogger(StatisticsStore.class);

    /** Counter name incremented for every request a service handles. */
    public static final String REQUESTS = "requests";

    /** Counter name incremented for every ERROR a service answers with. */
    public static final String ERRORS = "errors";

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, Entry> entries = new HashMap<>();
    private final Clock clock;

    public StatisticsStore() {
        this(Clock.systemUTC());
    }

    public StatisticsStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock cannot be null");
    }

    /**
     * Resets a service's statistics for a newly started instance.
     *
     * @param serviceName the service
     */
    public void initialize(String serviceName) {
        Instant now = clock.instant();
        withLock(() -> {
            Entry entry = new Entry();
            entry.startedAt = now;
            entries.put(serviceName, entry);
            return null;
        });
        logger.debug("Statistics initialized for {}", serviceName);
    }

    /**
     * Records a heartbeat stamped with the store's clock.
     *
     * @param serviceName the service
     */
    public void recordHeartbeat(String serviceName) {
        recordHeartbeat(serviceName, clock.instant());
    }

    /**
     * Records a heartbeat with an explicit timestamp.
     *
     * @param serviceName the service
     * @param at the heartbeat time
     */
    public void recordHeartbeat(String serviceName, Instant at) {
        withLock(() -> {
            entry(serviceName).lastBeatAt = at;
            return null;
        });
    }

    /**
     * Counts one handled request and refreshes the heartbeat in the same critical section.
     *
     * @param serviceName the service
     * @return the new request count
     */
    public long recordRequest(String serviceName) {
        Instant now = clock.instant();
        return withLock(() -> {
            Entry entry = entry(serviceName);
            entry.lastBeatAt = now;
            return entry.add(REQUESTS, 1);
        });
    }

    /**
     * Counts one request answered with an ERROR.
     *
     * @param serviceName the service
     * @return the new error count
     */
    public long recordError(String serviceName) {
        return incrementBy(serviceName, ERRORS, 1);
    }

    /**
     * Atomically increments a named counter by one.
     *
     * @param serviceName the service
     * @param counter the counter name
     * @return the value after incrementing
     */
    public long increment(String serviceName, String counter) {
        return incrementBy(serviceName, counter, 1);
    }

    /**
     * Atomically adds {@code delta} to a named counter.
     *
     * @param serviceName the service
     * @param counter the counter name
     * @param delta the amount to add
     * @return the value after adding
     */
    public long incrementBy(String serviceName, String counter, long delta) {
        Objects.requireNonNull(counter, "counter cannot be null");
        return withLock(() -> entry(serviceName).add(counter, delta));
    }

    /**
     * Reads a named counter.
     *
     * @param serviceName the service
     * @param counter the counter name
     * @return the current value, 0 if never written
     */
    public long counter(String serviceName, String counter) {
        return withLock(() -> {
            Entry entry = entries.get(serviceName);
            return entry == null ? 0L : entry.counters.getOrDefault(counter, 0L);
        });
    }

    /**
     * Reads the heartbeat record of a service.
     *
     * @param serviceName the service
     * @return the record, or empty if the service never wrote a heartbeat
     */
    public Optional<HeartbeatRecord> heartbeat(String serviceName) {
        return withLock(() -> {
            Entry entry = entries.get(serviceName);
            if (entry == null || entry.lastBeatAt == null) {
                return Optional.empty();
            }
            return Optional.of(new HeartbeatRecord(serviceName, entry.lastBeatAt,
                    entry.counters.getOrDefault(REQUESTS, 0L)));
        });
    }

    /**
     * Copies the statistics of one service.
     *
     * @param serviceName the service
     * @return a snapshot, empty if nothing was recorded
     */
    public ServiceStats snapshot(String serviceName) {
        return withLock(() -> {
            Entry entry = entries.get(serviceName);
            return entry == null ? ServiceStats.empty(serviceName) : entry.toStats(serviceName);
        });
    }

    /**
     * Copies the statistics of every service, ordered by name.
     *
     * @return snapshots keyed by service name
     */
    public Map<String, ServiceStats> snapshotAll() {
        return withLock(() -> {
            Map<String, ServiceStats> copy = new LinkedHashMap<>();
            new TreeMap<>(entries).forEach((name, entry) -> copy.put(name, entry.toStats(name)));
            return copy;
        });
    }

    public void remove(String serviceName) {
        withLock(() -> entries.remove(serviceName));
    }

    public void clear() {
        withLock(() -> {
            entries.clear();
            return null;
        });
    }

    public Clock getClock() {
        return clock;
    }

    private Entry entry(String serviceName) {
        Objects.requireNonNull(serviceName, "serviceName cannot be null");
        return entries.computeIfAbsent(serviceName, name -> new Entry());
    }

    private <R> R withLock(Supplier<R> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private static final class Entry {
        private Instant startedAt;
        private Instant lastBeatAt;
        private final Map<String, Long> counters = new HashMap<>();

        long add(String counter, long delta) {
            return counters.merge(counter, delta, Long::sum);
        }

        ServiceStats toStats(String serviceName) {
            return new ServiceStats(
                    serviceName,
                    startedAt,
                    lastBeatAt,
                    counters.getOrDefault(REQUESTS, 0L),
                    counters.getOrDefault(ERRORS, 0L),
                    counters);
        }
    }
}
