package com.sitemonitor.service.runtime;

import com.sitemonitor.core.model.PollCycleOutcome;
import com.sitemonitor.core.schedule.IntervalSchedule;
import com.sitemonitor.core.schedule.ScheduleParseException;
import com.sitemonitor.core.schedule.ScheduleParser;
import com.sitemonitor.core.schedule.ScheduleSpec;

import java.time.Clock;
import java.time.Duration;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one timer job per registered site and runs poll cycles on a worker pool. At most one cycle
 * per site is in flight; a firing that arrives while the previous cycle is still running is
 * dropped, not queued. Different sites run concurrently.
 */
public class SiteScheduler {
    private static final Logger LOGGER = Logger.getLogger(SiteScheduler.class.getName());

    private final PollCycle pollCycle;
    private final Clock clock;
    private final ScheduledExecutorService timerExecutor = Executors.newSingleThreadScheduledExecutor();
    private final ExecutorService workerExecutor;
    private final Map<String, RegisteredSite> sites = new LinkedHashMap<>();
    private boolean started;

    public SiteScheduler(PollCycle pollCycle, Clock clock, int workerThreads) {
        this.pollCycle = pollCycle;
        this.clock = clock;
        this.workerExecutor = Executors.newFixedThreadPool(Math.max(1, workerThreads));
    }

    /**
     * Registers or replaces a site. Returns false when the schedule text could not be parsed; the
     * site is still registered and can be run with {@link #runOnce}, but no job fires for it.
     */
    public synchronized boolean register(SiteDescriptor descriptor) {
        ScheduleSpec spec = null;
        try {
            spec = ScheduleParser.parse(descriptor.scheduleText());
        } catch (ScheduleParseException e) {
            LOGGER.warning("Site " + descriptor.id() + " left unscheduled: " + e.getMessage());
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Site " + descriptor.id() + " left unscheduled", e);
        }

        RegisteredSite previous = sites.get(descriptor.id());
        AtomicBoolean inFlight = new AtomicBoolean(false);
        if (previous != null) {
            previous.cancel();
            inFlight = previous.inFlight;
            LOGGER.info("Replacing job for site " + descriptor.id());
        }
        RegisteredSite site = new RegisteredSite(descriptor, spec, inFlight);
        sites.put(descriptor.id(), site);
        if (started && spec != null) {
            return arm(site);
        }
        return spec != null;
    }

    public synchronized void start() {
        if (started) {
            return;
        }
        started = true;
        for (RegisteredSite site : sites.values()) {
            if (site.spec != null) {
                arm(site);
            }
        }
    }

    /**
     * When the site's cron job fires next, or empty for interval jobs and unarmed sites.
     */
    synchronized Optional<ZonedDateTime> nextFireTime(String siteId) {
        RegisteredSite site = sites.get(siteId);
        return site == null ? Optional.empty() : Optional.ofNullable(site.nextFire);
    }

    /**
     * Runs one cycle for the site now, unless one is already in flight, in which case the result
     * is {@link PollCycleOutcome#SKIPPED}.
     */
    public CompletableFuture<PollCycleOutcome> runOnce(String siteId) {
        RegisteredSite site;
        synchronized (this) {
            site = sites.get(siteId);
        }
        if (site == null) {
            return CompletableFuture.failedFuture(new IllegalArgumentException("Unknown site: " + siteId));
        }
        if (!site.inFlight.compareAndSet(false, true)) {
            LOGGER.fine("Cycle for " + siteId + " still running, skipping firing");
            return CompletableFuture.completedFuture(PollCycleOutcome.SKIPPED);
        }
        try {
            return CompletableFuture
                    .supplyAsync(() -> pollCycle.run(site.descriptor), workerExecutor)
                    .whenComplete((outcome, error) -> site.inFlight.set(false));
        } catch (RejectedExecutionException e) {
            site.inFlight.set(false);
            return CompletableFuture.failedFuture(e);
        }
    }

    public synchronized List<SiteDescriptor> sites() {
        List<SiteDescriptor> descriptors = new ArrayList<>(sites.size());
        for (RegisteredSite site : sites.values()) {
            descriptors.add(site.descriptor);
        }
        return descriptors;
    }

    public synchronized Optional<SiteDescriptor> site(String siteId) {
        RegisteredSite site = sites.get(siteId);
        return site == null ? Optional.empty() : Optional.of(site.descriptor);
    }

    public synchronized Optional<SiteDescriptor> findByDisplayName(String displayName) {
        for (RegisteredSite site : sites.values()) {
            if (site.descriptor.displayName().equals(displayName)) {
                return Optional.of(site.descriptor);
            }
        }
        return Optional.empty();
    }

    public synchronized boolean isScheduled(String siteId) {
        RegisteredSite site = sites.get(siteId);
        return site != null && site.spec != null;
    }

    public void shutdown() {
        synchronized (this) {
            for (RegisteredSite site : sites.values()) {
                site.cancel();
            }
        }
        timerExecutor.shutdown();
        workerExecutor.shutdown();
        try {
            timerExecutor.awaitTermination(5, TimeUnit.SECONDS);
            workerExecutor.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private boolean arm(RegisteredSite site) {
        try {
            if (site.spec instanceof IntervalSchedule interval) {
                long periodMillis = interval.period().toMillis();
                site.job = timerExecutor.scheduleAtFixedRate(
                        () -> fire(site),
                        periodMillis,
                        periodMillis,
                        TimeUnit.MILLISECONDS
                );
                LOGGER.info("Scheduled " + site.descriptor.id() + " every " + interval.period());
            } else {
                armNext(site);
            }
            return true;
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "Could not schedule " + site.descriptor.id(), e);
            return false;
        }
    }

    private synchronized void armNext(RegisteredSite site) {
        if (sites.get(site.descriptor.id()) != site || timerExecutor.isShutdown()) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock);
        // A timer can run a little before the wall clock reaches the fire time.
        ZonedDateTime from = site.nextFire != null && site.nextFire.isAfter(now) ? site.nextFire : now;
        Optional<ZonedDateTime> next = site.spec.nextFireAfter(from);
        if (next.isEmpty()) {
            site.nextFire = null;
            LOGGER.warning("Schedule '" + site.spec.expression() + "' for " + site.descriptor.id() + " never fires");
            return;
        }
        site.nextFire = next.get();
        long delayMillis = Math.max(0, Duration.between(now, next.get()).toMillis());
        site.job = timerExecutor.schedule(() -> {
            fire(site);
            armNext(site);
        }, delayMillis, TimeUnit.MILLISECONDS);
        LOGGER.fine("Next run of " + site.descriptor.id() + " at " + next.get());
    }

    private void fire(RegisteredSite site) {
        runOnce(site.descriptor.id()).whenComplete((outcome, error) -> {
            if (error != null) {
                LOGGER.log(Level.WARNING, "Cycle for " + site.descriptor.id() + " failed", error);
            }
        });
    }

    private static final class RegisteredSite {
        private final SiteDescriptor descriptor;
        private final ScheduleSpec spec;
        private final AtomicBoolean inFlight;
        private volatile ScheduledFuture<?> job;
        private volatile ZonedDateTime nextFire;

        private RegisteredSite(SiteDescriptor descriptor, ScheduleSpec spec, AtomicBoolean inFlight) {
            this.descriptor = descriptor;
            this.spec = spec;
            this.inFlight = inFlight;
        }

        private void cancel() {
            ScheduledFuture<?> current = job;
            if (current != null) {
                current.cancel(false);
            }
        }
    }
}
