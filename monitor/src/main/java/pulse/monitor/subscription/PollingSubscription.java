package pulse.monitor.subscription;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import pulse.client.SampleFetcher;
import pulse.common.configuration.SubscriptionProperties;
import pulse.model.ChangeNotification;
import pulse.model.Sample;
import pulse.monitor.detect.ChangeDetector;
import pulse.monitor.notification.NotificationRegistry;
import pulse.subscription.ActivityListener;
import pulse.subscription.ActivityState;
import pulse.subscription.Subscription;
import pulse.subscription.SubscriptionListener;
import pulse.subscription.SubscriptionState;

/**
 * Keeps the snapshot of one metric fresh by polling a {@link SampleFetcher} on a one-shot timer.
 *
 * A cycle is one fetch plus its retries. Only one fetch is in flight at a time. The timer for the next cycle is armed once the previous
 * cycle has been applied, at the foreground interval while the activity signal is active and at the background interval otherwise.
 * Failed fetches are retried with an exponential backoff; when retries are exhausted the subscription is degraded until the next tick.
 *
 * All state is guarded by this object's monitor. Listener callbacks are queued while it is held and delivered in order after it is released,
 * so a listener may call back into this or any other subscription.
 */
public class PollingSubscription implements Subscription {

    private static final Logger log = LoggerFactory.getLogger(PollingSubscription.class);

    private final String id;
    private final String metricKey;
    private final SubscriptionProperties properties;
    private final SampleFetcher fetcher;
    private final ChangeDetector detector;
    private final NotificationRegistry registry;
    private final ActivityState activity;
    private final SubscriptionListener listener;
    private final ScheduledExecutorService scheduler;
    private final ActivityListener activityListener = this::activityChanged;

    private SubscriptionState state = SubscriptionState.IDLE;
    private SubscriptionState restingState = SubscriptionState.IDLE;
    private List<Sample> previous = ImmutableList.of();
    private List<Sample> current = null;
    private Throwable error = null;
    private int retryCount = 0;
    private boolean visible;
    private boolean started = false;
    private boolean disposed = false;
    // a fetch is outstanding
    private boolean fetching = false;
    // the outstanding fetch was requested by forceRefresh
    private boolean forcing = false;
    // a polling cycle (fetch or backoff) is in progress
    private boolean inCycle = false;
    private boolean forcePending = false;
    private boolean cyclePending = false;
    private ScheduledFuture<?> timer = null;
    private final Deque<Runnable> callbacks = new ArrayDeque<>();
    private boolean delivering = false;

    public PollingSubscription(String id, String metricKey, SubscriptionProperties properties, SampleFetcher fetcher, ChangeDetector detector,
                    NotificationRegistry registry, ActivityState activity, SubscriptionListener listener, ScheduledExecutorService scheduler) {
        Preconditions.checkArgument(null != id && !id.isEmpty(), "id must not be empty");
        Preconditions.checkArgument(null != metricKey && !metricKey.isEmpty(), "metricKey must not be empty");
        this.id = id;
        this.metricKey = metricKey;
        this.properties = Preconditions.checkNotNull(properties, "properties");
        this.fetcher = Preconditions.checkNotNull(fetcher, "fetcher");
        this.detector = Preconditions.checkNotNull(detector, "detector");
        this.registry = Preconditions.checkNotNull(registry, "registry");
        this.activity = Preconditions.checkNotNull(activity, "activity");
        this.listener = null == listener ? SubscriptionListener.NONE : listener;
        this.scheduler = Preconditions.checkNotNull(scheduler, "scheduler");
        this.visible = activity.isActive();
    }

    @Override
    public String getId() {
        return id;
    }

    @Override
    public String getMetricKey() {
        return metricKey;
    }

    @Override
    public void start() {
        startLocked();
        deliverCallbacks();
    }

    private synchronized void startLocked() {
        if (disposed || started) {
            return;
        }
        if (!properties.isEnabled()) {
            log.info("[{}] Polling disabled for {}", id, metricKey);
            return;
        }
        started = true;
        activity.addListener(activityListener);
        visible = activity.isActive();
        log.info("[{}] Starting subscription for {}, interval {} ms", id, metricKey, currentInterval());
        startCycle();
    }

    @Override
    public void refresh() {
        refreshLocked();
        deliverCallbacks();
    }

    private synchronized void refreshLocked() {
        if (disposed) {
            return;
        }
        if (inCycle || fetching) {
            log.trace("[{}] Refresh coalesced with the fetch in progress", id);
            return;
        }
        cancelTimer();
        startCycle();
    }

    @Override
    public void forceRefresh() {
        forceRefreshLocked();
        deliverCallbacks();
    }

    private synchronized void forceRefreshLocked() {
        if (disposed) {
            return;
        }
        if (inCycle || fetching) {
            log.trace("[{}] Forced refresh queued behind the fetch in progress", id);
            forcePending = true;
            return;
        }
        fetch(true);
    }

    @Override
    public synchronized void close() {
        if (disposed) {
            return;
        }
        disposed = true;
        cancelTimer();
        activity.removeListener(activityListener);
        fetching = false;
        forcing = false;
        inCycle = false;
        forcePending = false;
        cyclePending = false;
        callbacks.clear();
        state = SubscriptionState.DISPOSED;
        log.info("[{}] Closed subscription for {}", id, metricKey);
    }

    /**
     * @return a copy of the latest snapshot; changes to the returned samples do not affect change detection
     */
    @Override
    public synchronized List<Sample> getData() {
        return null == current ? ImmutableList.of() : copyOf(current);
    }

    /**
     * @return a copy of the snapshot replaced by the most recent successful fetch
     */
    public synchronized List<Sample> getPreviousData() {
        return copyOf(previous);
    }

    @Override
    public synchronized boolean isLoading() {
        return fetching && null == current;
    }

    @Override
    public synchronized boolean isFetching() {
        return fetching;
    }

    @Override
    public synchronized Throwable getError() {
        return error;
    }

    @Override
    public synchronized boolean isRefreshing() {
        return forcing || forcePending;
    }

    @Override
    public synchronized int getRetryCount() {
        return retryCount;
    }

    @Override
    public synchronized boolean isVisible() {
        return visible;
    }

    @Override
    public synchronized SubscriptionState getState() {
        return state;
    }

    @Override
    public synchronized boolean isDisposed() {
        return disposed;
    }

    synchronized long currentInterval() {
        return visible ? properties.getPollingInterval() : properties.getBackgroundPollingInterval();
    }

    /**
     * @return the backoff before the retry following the given number of failures
     */
    long retryDelay(int failures) {
        long delay = properties.getRetryDelay();
        for (int i = 1; i < failures && delay < properties.getMaxRetryDelay(); i++) {
            delay *= 2;
        }
        return Math.min(delay, properties.getMaxRetryDelay());
    }

    private void activityChanged(boolean ignored) {
        activityChangedLocked();
        deliverCallbacks();
    }

    private synchronized void activityChangedLocked() {
        // events may arrive out of order, the signal itself is authoritative
        boolean active = activity.isActive();
        if (disposed || visible == active) {
            return;
        }
        visible = active;
        log.debug("[{}] Activity changed to {}, interval now {} ms", id, active ? "active" : "inactive", currentInterval());
        if (!started) {
            return;
        }
        if (inCycle) {
            // the running cycle rearms at the new interval
            return;
        }
        cancelTimer();
        if (fetching) {
            cyclePending = true;
        } else {
            startCycle();
        }
    }

    private void tick() {
        tickLocked();
        deliverCallbacks();
    }

    private synchronized void tickLocked() {
        if (disposed) {
            return;
        }
        timer = null;
        if (fetching) {
            cyclePending = true;
            return;
        }
        startCycle();
    }

    private void retry() {
        retryLocked();
        deliverCallbacks();
    }

    private synchronized void retryLocked() {
        if (disposed) {
            return;
        }
        timer = null;
        fetch(false);
    }

    private void startCycle() {
        inCycle = true;
        retryCount = 0;
        fetch(false);
    }

    private void fetch(boolean forced) {
        fetching = true;
        forcing = forced;
        state = SubscriptionState.FETCHING;
        log.debug("[{}] Fetching {}{}", id, metricKey, forced ? " (forced)" : "");
        CompletableFuture<List<Sample>> future;
        try {
            future = fetcher.fetch(metricKey);
            if (null == future) {
                future = CompletableFuture.failedFuture(new IllegalStateException("Fetcher returned no result for " + metricKey));
            }
        } catch (RuntimeException e) {
            future = CompletableFuture.failedFuture(e);
        }
        future.whenComplete((result, t) -> {
            fetchComplete(forced, result, t);
            deliverCallbacks();
        });
    }

    private synchronized void fetchComplete(boolean forced, List<Sample> result, Throwable t) {
        if (disposed) {
            log.debug("[{}] Discarding fetch result for closed subscription", id);
            return;
        }
        try {
            fetching = false;
            forcing = false;
            if (forced) {
                forcedComplete(result, t);
            } else {
                cycleFetchComplete(result, t);
            }
        } catch (RuntimeException e) {
            log.error("[{}] Error applying fetch result", id, e);
        }
        runPending();
    }

    private void forcedComplete(List<Sample> result, Throwable t) {
        if (null == t) {
            applySnapshot(result);
            error = null;
            restingState = SubscriptionState.SCHEDULED_WAIT;
        } else {
            Throwable cause = unwrap(t);
            log.warn("[{}] Forced refresh of {} failed: {}", id, metricKey, cause.getMessage());
            error = cause;
            notifyError(cause, 0);
        }
        state = null == timer ? SubscriptionState.IDLE : restingState;
    }

    private void cycleFetchComplete(List<Sample> result, Throwable t) {
        if (null == t) {
            applySnapshot(result);
            retryCount = 0;
            error = null;
            inCycle = false;
            arm(SubscriptionState.SCHEDULED_WAIT);
            return;
        }
        Throwable cause = unwrap(t);
        if (retryCount < properties.getMaxRetries()) {
            notifyError(cause, retryCount + 1);
            retryCount++;
            long delay = retryDelay(retryCount);
            log.warn("[{}] Fetch of {} failed, retry {} of {} in {} ms: {}", id, metricKey, retryCount, properties.getMaxRetries(), delay,
                            cause.getMessage());
            state = SubscriptionState.RETRYING;
            schedule(this::retry, delay);
            return;
        }
        log.error("[{}] Fetch of {} failed after {} retries, degraded until next poll", id, metricKey, retryCount, cause);
        error = cause;
        inCycle = false;
        callbacks.add(() -> listener.onDegraded(id, cause));
        arm(SubscriptionState.DEGRADED);
    }

    private void runPending() {
        if (disposed || fetching || inCycle) {
            return;
        }
        if (forcePending) {
            forcePending = false;
            fetch(true);
        } else if (cyclePending) {
            cyclePending = false;
            cancelTimer();
            startCycle();
        }
    }

    private void applySnapshot(List<Sample> result) {
        List<Sample> snapshot = null == result ? ImmutableList.of()
                        : result.stream().filter(Objects::nonNull).map(Sample::new).collect(ImmutableList.toImmutableList());
        previous = null == current ? ImmutableList.of() : current;
        current = snapshot;
        log.debug("[{}] Received {} samples for {}", id, snapshot.size(), metricKey);
        List<ChangeNotification> changes = detector.detect(previous, current, properties.getChangeThreshold());
        for (ChangeNotification n : changes) {
            registry.add(n);
            callbacks.add(() -> listener.onChange(id, n));
        }
        List<Sample> delivered = copyOf(snapshot);
        callbacks.add(() -> listener.onData(id, delivered));
    }

    private void notifyError(Throwable cause, int attempt) {
        callbacks.add(() -> listener.onError(id, cause, attempt));
    }

    /**
     * Runs queued listener callbacks on the calling thread once no lock is held. A single thread delivers at a time so callbacks keep their
     * order; callbacks queued meanwhile by other threads are picked up by the delivering one.
     */
    private void deliverCallbacks() {
        if (Thread.holdsLock(this)) {
            return;
        }
        synchronized (this) {
            if (delivering) {
                return;
            }
            delivering = true;
        }
        while (true) {
            Runnable next;
            synchronized (this) {
                next = disposed ? null : callbacks.poll();
                if (null == next) {
                    delivering = false;
                    return;
                }
            }
            try {
                next.run();
            } catch (RuntimeException e) {
                log.error("[{}] Error in listener", id, e);
            }
        }
    }

    private static List<Sample> copyOf(List<Sample> samples) {
        return samples.stream().map(Sample::new).collect(ImmutableList.toImmutableList());
    }

    private void arm(SubscriptionState waitState) {
        restingState = waitState;
        state = waitState;
        if (!started) {
            // only reachable through refresh before start
            state = SubscriptionState.IDLE;
            return;
        }
        schedule(this::tick, currentInterval());
    }

    private void schedule(Runnable task, long delay) {
        cancelTimer();
        try {
            timer = scheduler.schedule(task, delay, TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.warn("[{}] Scheduler rejected the next poll of {}", id, metricKey);
            inCycle = false;
        }
    }

    private void cancelTimer() {
        if (null != timer) {
            timer.cancel(false);
            timer = null;
        }
    }

    private static Throwable unwrap(Throwable t) {
        if ((t instanceof CompletionException || t instanceof ExecutionException) && null != t.getCause()) {
            return t.getCause();
        }
        return t;
    }
}
