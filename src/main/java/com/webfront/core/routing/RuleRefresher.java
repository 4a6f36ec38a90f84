package com.webfront.core.routing;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

import com.webfront.core.exceptions.ConfigException;
import com.webfront.core.utils.ThreadUtils;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owns the current {@link RuleTable} and keeps it in sync with the rule file.
 *
 * <p>
 * The first load happens in the constructor and must succeed. After
 * {@link #start()}, the file is polled on a single background thread; every
 * successful load replaces the table reference in one atomic step, and every
 * failed one leaves the previous table in place until the next tick.
 * Readers call {@link #current()} once per request and keep using that
 * snapshot.
 * </p>
 */
public class RuleRefresher implements Supplier<RuleTable>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RuleRefresher.class);

    private final RuleLoader loader;
    private final Duration pollInterval;
    private final AtomicReference<RuleTable> current = new AtomicReference<>();
    private final ScheduledExecutorService scheduler;
    private final Counter reloads;
    private final Counter reloadFailures;

    private ScheduledFuture<?> task;

    /**
     * Performs the mandatory first load.
     *
     * @param loader       Loader for the rule file.
     * @param pollInterval Delay between two checks of the file.
     * @param registry     Meter registry for reload metrics.
     * @throws ConfigException if the initial rule table cannot be loaded.
     */
    @SuppressFBWarnings("EI_EXPOSE_REP2")
    public RuleRefresher(RuleLoader loader, Duration pollInterval, MeterRegistry registry) {
        this.loader = loader;
        this.pollInterval = pollInterval;

        RuleTable initial = loader.load(null)
                .orElseThrow(() -> new ConfigException("Initial rule load produced no table"));
        current.set(initial);
        log.info("Loaded {} rules from {} ({} inert)", initial.size(), loader.getRulesFile(), initial.inertCount());

        this.reloads = Counter.builder("webfront.rules.reloads")
                .description("Number of rule tables published after a change")
                .register(registry);
        this.reloadFailures = Counter.builder("webfront.rules.reload.failures")
                .description("Number of failed attempts to reload the rule file")
                .register(registry);
        Gauge.builder("webfront.rules.size", current, ref -> ref.get().size())
                .description("Number of rules in the current table")
                .register(registry);

        this.scheduler = Executors.newSingleThreadScheduledExecutor(ThreadUtils.daemonFactory("rule-refresher"));
    }

    /**
     * Starts polling the rule file.
     */
    public synchronized void start() {
        if (task != null) {
            return;
        }
        long delay = pollInterval.toMillis();
        task = scheduler.scheduleWithFixedDelay(this::refresh, delay, delay, TimeUnit.MILLISECONDS);
        log.info("Polling {} every {}", loader.getRulesFile(), pollInterval);
    }

    /**
     * Checks the rule file once and publishes a new table if it changed.
     * Failures are logged and the current table stays in force.
     *
     * @return true if a new table was published.
     */
    public boolean refresh() {
        try {
            Optional<RuleTable> next = loader.load(current.get());
            if (next.isEmpty()) {
                return false;
            }
            RuleTable table = next.get();
            current.set(table);
            reloads.increment();
            log.info("Reloaded {} rules from {} ({} inert)", table.size(), loader.getRulesFile(),
                    table.inertCount());
            return true;
        } catch (ConfigException e) {
            reloadFailures.increment();
            log.error("Failed to reload rules, keeping previous table: {}", e.getMessage());
            return false;
        } catch (RuntimeException e) {
            // An exception escaping a scheduled task would cancel all later polls
            reloadFailures.increment();
            log.error("Unexpected error while reloading rules", e);
            return false;
        }
    }

    /**
     * @return The current rule table snapshot; never null.
     */
    public RuleTable current() {
        return current.get();
    }

    @Override
    public RuleTable get() {
        return current();
    }

    /**
     * Stops polling. The last published table remains readable.
     */
    @Override
    public synchronized void close() {
        if (task != null) {
            task.cancel(false);
            task = null;
        }
        scheduler.shutdownNow();
        try {
            if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warn("Rule refresher did not terminate cleanly after 5 s");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
