package com.baselinesentinel.runner;

import com.baselinesentinel.core.engine.SentinelEngine;
import com.baselinesentinel.core.model.AnomalyReport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the {@link SentinelEngine} once a day (or every N days) at a fixed
 * local time, and on demand.
 *
 * <p>
 * Manual runs execute on their own threads, so a trigger may overlap a
 * scheduled run. The engine keeps no state between runs.
 * </p>
 *
 * @since 1.0.0
 */
public final class SentinelScheduler implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(SentinelScheduler.class);

    private final SentinelEngine engine;
    private final ZoneId zone;
    private final LocalTime runAt;
    private final int intervalDays;
    private final Clock clock;
    private final ScheduledExecutorService ticker;
    private final ExecutorService manualRuns;

    public SentinelScheduler(SentinelEngine engine, ZoneId zone, LocalTime runAt, int intervalDays, Clock clock) {
        this.engine = Objects.requireNonNull(engine, "SentinelEngine must not be null");
        this.zone = Objects.requireNonNull(zone, "zone must not be null");
        this.runAt = Objects.requireNonNull(runAt, "runAt must not be null");
        if (intervalDays < 1) {
            throw new IllegalArgumentException("intervalDays must be >= 1, got: " + intervalDays);
        }
        this.intervalDays = intervalDays;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.ticker = Executors.newSingleThreadScheduledExecutor(daemon("sentinel-scheduler"));
        this.manualRuns = Executors.newCachedThreadPool(daemon("sentinel-manual-run"));
    }

    /**
     * Schedule the periodic run. The first run happens at the next
     * occurrence of the configured local time. Each later run is planned
     * on the wall clock, {@code intervalDays} calendar days after the
     * previous one, so daylight saving changes do not shift it.
     */
    public void start() {
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone));
        ZonedDateTime first = now.plus(delayUntilNext(now, runAt));
        scheduleAt(first);
        LOG.info("Scheduled detection at {} {} every {} day(s); first run at {}", runAt, zone, intervalDays, first);
    }

    private void scheduleAt(ZonedDateTime when) {
        Duration delay = Duration.between(clock.instant(), when.toInstant());
        if (delay.isNegative()) {
            delay = Duration.ZERO;
        }
        ticker.schedule(() -> tick(when), delay.toMillis(), TimeUnit.MILLISECONDS);
    }

    private void tick(ZonedDateTime scheduledFor) {
        runOnce();
        ZonedDateTime next = nextRunAfter(scheduledFor, runAt, intervalDays);
        try {
            scheduleAt(next);
            LOG.debug("Next detection run at {}", next);
        } catch (RejectedExecutionException e) {
            LOG.info("Scheduler shut down; no further runs planned");
        }
    }

    /**
     * Request an immediate, asynchronous run.
     *
     * @return {@code false} if the scheduler is shut down
     */
    public boolean trigger() {
        try {
            manualRuns.execute(this::runOnce);
        } catch (RejectedExecutionException e) {
            LOG.warn("Manual trigger rejected: scheduler is shut down");
            return false;
        }
        LOG.info("Manual detection run started");
        return true;
    }

    /**
     * Execute one run synchronously on the calling thread.
     *
     * @return the report, empty if the run failed
     */
    Optional<AnomalyReport> runOnce() {
        try {
            AnomalyReport report = engine.run(clock.instant());
            LOG.info("Detection run finished with {} anomaly(ies)", report.totalAnomalies());
            return Optional.of(report);
        } catch (RuntimeException e) {
            // an escaping exception would stop the rescheduling chain
            LOG.error("Detection run failed: {}", e.getMessage(), e);
            return Optional.empty();
        }
    }

    /**
     * Time from {@code now} until the next {@code at} on the local clock.
     * Returns a full day when {@code now} is exactly at {@code at}.
     */
    static Duration delayUntilNext(ZonedDateTime now, LocalTime at) {
        ZonedDateTime next = now.with(at);
        if (!next.isAfter(now)) {
            next = next.plusDays(1);
        }
        return Duration.between(now, next);
    }

    /**
     * The run {@code intervalDays} calendar days after {@code previous}, at
     * {@code at} local time in the zone of {@code previous}.
     */
    static ZonedDateTime nextRunAfter(ZonedDateTime previous, LocalTime at, int intervalDays) {
        return ZonedDateTime.of(previous.toLocalDate().plusDays(intervalDays), at, previous.getZone());
    }

    @Override
    public void close() {
        ticker.shutdownNow();
        manualRuns.shutdownNow();
    }

    private static ThreadFactory daemon(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
