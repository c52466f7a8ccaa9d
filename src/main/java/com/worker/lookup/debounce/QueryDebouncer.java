package com.worker.lookup.debounce;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Coalesces bursts of calls sharing a key so only the last one runs.
 *
 * <p>Each call to a debounced function replaces whatever is pending under its key
 * and schedules itself {@code delay} in the future. The replaced call's future is
 * cancelled; if it had already started, its in-flight future is cancelled too so
 * the work behind it (a store fetch, typically) can stop.</p>
 *
 * <p>At most one scheduled execution exists per key. The swap in the key→call map
 * happens inside {@link ConcurrentHashMap#compute}, so two racing callers can never
 * both stay scheduled.</p>
 *
 * <pre>
 * Function&lt;String, CompletableFuture&lt;SearchResponse&lt;Worker&gt;&gt;&gt; search =
 *         debouncer.debounce("worker-search", orchestrator::searchAsync, Duration.ofMillis(300));
 * search.apply("joh");
 * search.apply("john").thenAccept(render);   // only this one reaches the store
 * </pre>
 */
public class QueryDebouncer implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(QueryDebouncer.class);

    public static final Duration DEFAULT_DELAY = Duration.ofMillis(300);

    private final ScheduledExecutorService scheduler;
    private final boolean ownsScheduler;
    private final Duration defaultDelay;
    private final ConcurrentHashMap<String, PendingCall<?>> pending = new ConcurrentHashMap<>();

    public QueryDebouncer() {
        this(DEFAULT_DELAY);
    }

    public QueryDebouncer(Duration defaultDelay) {
        this(Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "query-debouncer");
            t.setDaemon(true);
            return t;
        }), true, defaultDelay);
    }

    /**
     * Uses a caller-managed scheduler; {@link #shutdown()} leaves it running.
     */
    public QueryDebouncer(ScheduledExecutorService scheduler, Duration defaultDelay) {
        this(scheduler, false, defaultDelay);
    }

    private QueryDebouncer(ScheduledExecutorService scheduler, boolean ownsScheduler, Duration defaultDelay) {
        if (defaultDelay == null || defaultDelay.isNegative()) {
            throw new IllegalArgumentException("defaultDelay must be >= 0");
        }
        this.scheduler = scheduler;
        this.ownsScheduler = ownsScheduler;
        this.defaultDelay = defaultDelay;
    }

    /**
     * Debounces {@code fn} under {@code key} with the default delay.
     */
    public <A, R> Function<A, CompletableFuture<R>> debounce(
            String key, Function<? super A, ? extends CompletableFuture<R>> fn) {
        return debounce(key, fn, defaultDelay);
    }

    /**
     * Wraps {@code fn} so that calls made within {@code delay} of each other collapse
     * into the last one.
     *
     * @param key   identity shared by calls that should coalesce
     * @param fn    the work to run; its future's outcome completes the caller's future
     * @param delay quiet window before the last call runs
     * @return a function whose futures complete with the result of the call that ran,
     *         or are cancelled if a later call replaced them
     */
    public <A, R> Function<A, CompletableFuture<R>> debounce(
            String key, Function<? super A, ? extends CompletableFuture<R>> fn, Duration delay) {
        if (key == null || fn == null) {
            throw new IllegalArgumentException("key and fn are required");
        }
        if (delay == null || delay.isNegative()) {
            throw new IllegalArgumentException("delay must be >= 0");
        }
        long delayMs = delay.toMillis();
        return arg -> submit(key, fn, arg, delayMs);
    }

    private <A, R> CompletableFuture<R> submit(String key, Function<? super A, ? extends CompletableFuture<R>> fn,
                                               A arg, long delayMs) {
        PendingCall<R> call = new PendingCall<>(key);
        List<PendingCall<?>> replaced = new ArrayList<>(1);

        pending.compute(key, (k, previous) -> {
            if (previous != null) {
                previous.markCancelled();
                replaced.add(previous);
            }
            call.timer = scheduler.schedule(() -> execute(call, fn, arg), delayMs, TimeUnit.MILLISECONDS);
            return call;
        });

        // Completing futures runs callbacks, so keep it out of compute()
        replaced.forEach(PendingCall::releaseWaiters);
        if (!replaced.isEmpty()) {
            log.debug("debounce.replaced key={}", key);
        }

        call.result.whenComplete((value, error) -> {
            if (call.result.isCancelled() && call.markCancelled()) {
                call.releaseWaiters();
                pending.remove(key, call);
            }
        });
        return call.result;
    }

    private <A, R> void execute(PendingCall<R> call, Function<? super A, ? extends CompletableFuture<R>> fn, A arg) {
        if (!call.start()) {
            return;
        }
        CompletableFuture<R> inFlight;
        try {
            inFlight = fn.apply(arg);
        } catch (RuntimeException e) {
            pending.remove(call.key, call);
            call.result.completeExceptionally(e);
            return;
        }
        if (inFlight == null) {
            pending.remove(call.key, call);
            call.result.complete(null);
            return;
        }
        call.attach(inFlight);
        inFlight.whenComplete((value, error) -> {
            pending.remove(call.key, call);
            if (error != null) {
                call.result.completeExceptionally(unwrap(error));
            } else {
                call.result.complete(value);
            }
        });
    }

    /**
     * Cancels the pending call for {@code key} without running it.
     *
     * @return {@code true} if a call was pending
     */
    public boolean clear(String key) {
        PendingCall<?> call = pending.remove(key);
        if (call == null) {
            return false;
        }
        call.markCancelled();
        call.releaseWaiters();
        return true;
    }

    /**
     * Cancels every pending call.
     */
    public void clearAll() {
        for (String key : List.copyOf(pending.keySet())) {
            clear(key);
        }
    }

    /**
     * Returns whether a call is scheduled or running for {@code key}.
     */
    public boolean isPending(String key) {
        PendingCall<?> call = pending.get(key);
        return call != null && !call.isCancelled();
    }

    /**
     * Number of keys with a scheduled or running call.
     */
    public int pendingCount() {
        return (int) pending.values().stream().filter(c -> !c.isCancelled()).count();
    }

    public Duration getDefaultDelay() {
        return defaultDelay;
    }

    /**
     * Cancels everything pending and, if this debouncer created its scheduler, stops it.
     */
    public void shutdown() {
        clearAll();
        if (ownsScheduler) {
            scheduler.shutdownNow();
        }
    }

    @Override
    public void close() {
        shutdown();
    }

    private static Throwable unwrap(Throwable error) {
        if ((error instanceof CompletionException || error instanceof ExecutionException)
                && error.getCause() != null) {
            return error.getCause();
        }
        return error;
    }

    /**
     * One debounced invocation: its timer, the caller's future and, once started,
     * the future of the work itself.
     */
    private static final class PendingCall<R> {
        final String key;
        final CompletableFuture<R> result = new CompletableFuture<>();
        volatile ScheduledFuture<?> timer;

        private boolean cancelled;
        private boolean started;
        private CompletableFuture<? extends R> inFlight;

        PendingCall(String key) {
            this.key = key;
        }

        synchronized boolean start() {
            if (cancelled) {
                return false;
            }
            started = true;
            return true;
        }

        synchronized void attach(CompletableFuture<? extends R> future) {
            if (cancelled) {
                // Replaced between start() and attach()
                future.cancel(true);
                return;
            }
            inFlight = future;
        }

        /**
         * Flags the call and stops its timer. Does not complete any future.
         *
         * @return {@code false} if it was already cancelled
         */
        synchronized boolean markCancelled() {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            ScheduledFuture<?> t = timer;
            if (t != null && !started) {
                t.cancel(false);
            }
            return true;
        }

        synchronized boolean isCancelled() {
            return cancelled;
        }

        void releaseWaiters() {
            CompletableFuture<? extends R> running;
            synchronized (this) {
                running = inFlight;
            }
            if (running != null) {
                running.cancel(true);
            }
            result.cancel(false);
        }
    }
}
