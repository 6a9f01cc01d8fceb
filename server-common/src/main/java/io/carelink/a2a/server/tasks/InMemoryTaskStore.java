package io.carelink.a2a.server.tasks;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import io.carelink.a2a.server.config.A2AConfigProvider;
import io.carelink.a2a.spec.Task;
import io.carelink.a2a.util.Assert;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local {@link TaskStore}.
 * <p>
 * Tasks that reached a terminal state are evicted once they have been terminal for longer
 * than the configured time-to-live. Eviction runs as a sweep at most once per sweep interval,
 * triggered by {@link #save(Task)}, or explicitly through {@link #evictExpired()}. Tasks that
 * are still in progress are never evicted. A zero time-to-live disables eviction.
 */
public class InMemoryTaskStore implements TaskStore {

    private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryTaskStore.class);

    public static final String TTL_SECONDS = "a2a.tasks.ttl-seconds";
    public static final String SWEEP_INTERVAL_SECONDS = "a2a.tasks.sweep-interval-seconds";

    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final Duration DEFAULT_SWEEP_INTERVAL = Duration.ofMinutes(1);

    private final ConcurrentMap<String, StoredTask> tasks = new ConcurrentHashMap<>();
    private final Duration ttl;
    private final Duration sweepInterval;
    private final Clock clock;
    private final AtomicReference<Instant> nextSweep;

    public InMemoryTaskStore() {
        this(DEFAULT_TTL, DEFAULT_SWEEP_INTERVAL, Clock.systemUTC());
    }

    public InMemoryTaskStore(A2AConfigProvider config) {
        this(config.getSecondsValue(TTL_SECONDS), config.getSecondsValue(SWEEP_INTERVAL_SECONDS), Clock.systemUTC());
    }

    public InMemoryTaskStore(Duration ttl, Duration sweepInterval, Clock clock) {
        Assert.checkNotNullParam("ttl", ttl);
        Assert.checkNotNullParam("sweepInterval", sweepInterval);
        if (ttl.isNegative() || sweepInterval.isNegative()) {
            throw new IllegalArgumentException("Eviction durations may not be negative");
        }
        this.ttl = ttl;
        this.sweepInterval = sweepInterval;
        this.clock = Assert.checkNotNullParam("clock", clock);
        this.nextSweep = new AtomicReference<>(clock.instant().plus(sweepInterval));
    }

    @Override
    public void save(Task task) {
        Assert.checkNotNullParam("task", task);
        tasks.compute(task.id(), (id, previous) -> {
            @Nullable Instant finishedAt = null;
            if (task.status().state().isFinal()) {
                finishedAt = previous != null && previous.finishedAt() != null ? previous.finishedAt() : clock.instant();
            }
            return new StoredTask(task, finishedAt);
        });
        maybeSweep();
    }

    @Override
    public @Nullable Task get(String taskId) {
        StoredTask stored = tasks.get(taskId);
        return stored == null ? null : stored.task();
    }

    @Override
    public void delete(String taskId) {
        tasks.remove(taskId);
    }

    @Override
    public int size() {
        return tasks.size();
    }

    /**
     * Removes every task that has been terminal for longer than the time-to-live.
     *
     * @return the number of evicted tasks
     */
    public int evictExpired() {
        if (ttl.isZero()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(ttl);
        AtomicInteger evicted = new AtomicInteger();
        tasks.values().removeIf(stored -> {
            Instant finishedAt = stored.finishedAt();
            if (finishedAt != null && !finishedAt.isAfter(cutoff)) {
                evicted.incrementAndGet();
                return true;
            }
            return false;
        });
        if (evicted.get() > 0) {
            LOGGER.debug("Evicted {} terminal tasks older than {}", evicted.get(), ttl);
        }
        return evicted.get();
    }

    private void maybeSweep() {
        if (ttl.isZero()) {
            return;
        }
        Instant now = clock.instant();
        Instant scheduled = nextSweep.get();
        if (now.isBefore(scheduled)) {
            return;
        }
        if (nextSweep.compareAndSet(scheduled, now.plus(sweepInterval))) {
            evictExpired();
        }
    }

    private record StoredTask(Task task, @Nullable Instant finishedAt) {
    }
}
