package pulse.monitor.subscription;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collections;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Before;
import org.junit.Test;

import pulse.client.FetchException;
import pulse.common.configuration.NotificationProperties;
import pulse.common.configuration.SubscriptionProperties;
import pulse.model.Sample;
import pulse.model.Severity;
import pulse.monitor.ManualScheduledExecutor;
import pulse.monitor.detect.ChangeDetector;
import pulse.monitor.notification.NotificationRegistry;
import pulse.model.ChangeNotification;
import pulse.subscription.ActivityListener;
import pulse.subscription.ActivityState;
import pulse.subscription.ManualActivityState;
import pulse.subscription.SubscriptionListener;
import pulse.subscription.SubscriptionState;

public class PollingSubscriptionTest {

    private ManualScheduledExecutor scheduler;
    private StubFetcher fetcher;
    private NotificationRegistry registry;
    private ManualActivityState activity;
    private RecordingListener listener;
    private SubscriptionProperties properties;

    @Before
    public void setup() {
        scheduler = new ManualScheduledExecutor();
        fetcher = new StubFetcher();
        registry = new NotificationRegistry(new NotificationProperties(), scheduler.getClock());
        activity = new ManualActivityState(true);
        listener = new RecordingListener();
        properties = new SubscriptionProperties();
    }

    private PollingSubscription subscription() {
        return new PollingSubscription("sub-1", "server-1/cpu", properties, fetcher, new ChangeDetector(scheduler.getClock()), registry, activity,
                        listener, scheduler);
    }

    private static List<Sample> snapshot(double... values) {
        Sample[] samples = new Sample[values.length];
        for (int i = 0; i < values.length; i++) {
            samples[i] = Sample.newBuilder().id("s" + i).metricId("m" + i).value(values[i]).timestamp("2024-03-05T12:00:00Z").build();
        }
        return Arrays.asList(samples);
    }

    @Test
    public void testStartFetchesThenPolls() {
        PollingSubscription s = subscription();
        assertEquals(SubscriptionState.IDLE, s.getState());
        s.start();
        assertEquals(1, fetcher.calls());
        assertEquals(SubscriptionState.FETCHING, s.getState());
        assertTrue(s.isLoading());
        assertTrue(s.isFetching());
        // no timer while the first fetch is in flight
        assertEquals(0, scheduler.pendingCount());

        fetcher.complete(snapshot(100));
        assertFalse(s.isLoading());
        assertFalse(s.isFetching());
        assertEquals(SubscriptionState.SCHEDULED_WAIT, s.getState());
        assertEquals(snapshot(100), s.getData());
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
        assertEquals(1, listener.data.size());

        scheduler.advance(29_999);
        assertEquals(1, fetcher.calls());
        scheduler.advance(1);
        assertEquals(2, fetcher.calls());
        assertTrue(s.isFetching());
        assertFalse(s.isLoading());
    }

    @Test
    public void testChangesReachRegistry() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100, 10));
        assertTrue(s.getPreviousData().isEmpty());
        assertEquals(0, registry.size());

        scheduler.advance(30_000);
        fetcher.complete(snapshot(160, 11));
        assertEquals(snapshot(100, 10), s.getPreviousData());
        assertEquals(snapshot(160, 11), s.getData());
        assertEquals(1, registry.size());
        assertEquals(Severity.HIGH, registry.get("m0").getSeverity());
        assertEquals(60.0, registry.get("m0").getChangePercent(), 0.0);
        assertEquals(1, listener.changes.size());
        assertEquals("m0", listener.changes.get(0).getMetricId());
    }

    @Test
    public void testRetriesThenDegraded() {
        FetchException failure = new FetchException(503, "Fetch failed with status 503", "");
        fetcher.failWith(failure);
        PollingSubscription s = subscription();
        s.start();
        assertEquals(1, fetcher.calls());
        assertEquals(SubscriptionState.RETRYING, s.getState());
        assertEquals(1, s.getRetryCount());
        assertEquals(Collections.singletonList(1000L), scheduler.pendingDelays());

        scheduler.advance(1000);
        assertEquals(2, fetcher.calls());
        assertEquals(Collections.singletonList(2000L), scheduler.pendingDelays());
        scheduler.advance(2000);
        assertEquals(3, fetcher.calls());
        assertEquals(Collections.singletonList(4000L), scheduler.pendingDelays());
        scheduler.advance(4000);

        assertEquals(4, fetcher.calls());
        assertEquals(Arrays.asList(1, 2, 3), listener.errorAttempts);
        assertEquals(1, listener.degraded.size());
        assertSame(failure, listener.degraded.get(0));
        assertEquals(SubscriptionState.DEGRADED, s.getState());
        assertSame(failure, s.getError());
        assertEquals(3, s.getRetryCount());
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());

        // the next regular tick starts a fresh cycle
        fetcher.failWith(null);
        scheduler.advance(30_000);
        assertEquals(5, fetcher.calls());
        assertEquals(0, s.getRetryCount());
        assertEquals(SubscriptionState.FETCHING, s.getState());
        fetcher.complete(snapshot(1));
        assertNull(s.getError());
        assertEquals(SubscriptionState.SCHEDULED_WAIT, s.getState());
        assertEquals(3, listener.errorAttempts.size());
    }

    @Test
    public void testRetryDelayCapped() {
        properties.setMaxRetryDelay(5000);
        PollingSubscription s = subscription();
        assertEquals(1000, s.retryDelay(1));
        assertEquals(2000, s.retryDelay(2));
        assertEquals(4000, s.retryDelay(3));
        assertEquals(5000, s.retryDelay(4));
        assertEquals(5000, s.retryDelay(40));
    }

    @Test
    public void testFetcherThrowing() {
        PollingSubscription s = new PollingSubscription("sub-1", "server-1/cpu", properties, key -> {
            throw new IllegalStateException("boom");
        }, new ChangeDetector(scheduler.getClock()), registry, activity, listener, scheduler);
        s.start();
        assertEquals(SubscriptionState.RETRYING, s.getState());
        assertEquals(Collections.singletonList(1), listener.errorAttempts);
    }

    @Test
    public void testBackgroundInterval() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(1));
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());

        activity.setActive(false);
        assertFalse(s.isVisible());
        assertEquals(2, fetcher.calls());
        assertEquals(0, scheduler.pendingCount());
        fetcher.complete(snapshot(1));
        assertEquals(Collections.singletonList(120000L), scheduler.pendingDelays());

        activity.setActive(true);
        assertEquals(3, fetcher.calls());
        fetcher.complete(snapshot(1));
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
    }

    @Test
    public void testActivityChangeDuringFetch() {
        PollingSubscription s = subscription();
        s.start();
        activity.setActive(false);
        assertEquals(1, fetcher.calls());
        fetcher.complete(snapshot(1));
        assertEquals(1, fetcher.calls());
        assertEquals(Collections.singletonList(120000L), scheduler.pendingDelays());
        assertFalse(s.isVisible());
    }

    @Test
    public void testCloseDiscardsInFlightFetch() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100));
        scheduler.advance(30_000);
        assertEquals(2, fetcher.calls());

        s.close();
        assertTrue(s.isDisposed());
        assertEquals(SubscriptionState.DISPOSED, s.getState());
        fetcher.complete(snapshot(500));
        assertEquals(snapshot(100), s.getData());
        assertEquals(0, registry.size());
        assertEquals(1, listener.data.size());
        assertTrue(listener.changes.isEmpty());
        assertEquals(0, scheduler.pendingCount());
        assertFalse(s.isFetching());

        // no longer follows the activity signal and cannot be restarted
        activity.setActive(false);
        s.refresh();
        s.forceRefresh();
        s.start();
        assertEquals(2, fetcher.calls());
        assertEquals(SubscriptionState.DISPOSED, s.getState());
    }

    @Test
    public void testCloseCancelsRetry() {
        fetcher.failWith(new FetchException(FetchException.IO_ERROR, "refused", ""));
        PollingSubscription s = subscription();
        s.start();
        assertEquals(1, scheduler.pendingCount());
        s.close();
        assertEquals(0, scheduler.pendingCount());
        scheduler.advance(60_000);
        assertEquals(1, fetcher.calls());
    }

    @Test
    public void testRefreshCoalesced() {
        PollingSubscription s = subscription();
        s.start();
        s.refresh();
        assertEquals(1, fetcher.calls());
        fetcher.complete(snapshot(1));

        s.refresh();
        assertEquals(2, fetcher.calls());
        assertEquals(0, scheduler.pendingCount());
        fetcher.complete(snapshot(1));
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
    }

    @Test
    public void testForceRefresh() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100));
        scheduler.advance(10_000);

        s.forceRefresh();
        assertEquals(2, fetcher.calls());
        assertTrue(s.isRefreshing());
        assertTrue(s.isFetching());
        fetcher.complete(snapshot(130));
        assertFalse(s.isRefreshing());
        assertEquals(snapshot(130), s.getData());
        assertEquals(1, registry.size());
        assertEquals(SubscriptionState.SCHEDULED_WAIT, s.getState());
        // the regular timer is left alone
        assertEquals(Collections.singletonList(20000L), scheduler.pendingDelays());
    }

    @Test
    public void testForceRefreshFailureDoesNotRetry() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100));

        s.forceRefresh();
        FetchException failure = new FetchException(500, "Fetch failed with status 500", "");
        fetcher.fail(failure);
        assertEquals(Collections.singletonList(0), listener.errorAttempts);
        assertSame(failure, s.getError());
        assertEquals(0, s.getRetryCount());
        assertFalse(s.isRefreshing());
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
        assertEquals(snapshot(100), s.getData());
    }

    @Test
    public void testForceRefreshQueuedBehindCycle() {
        PollingSubscription s = subscription();
        s.start();
        s.forceRefresh();
        assertEquals(1, fetcher.calls());
        assertTrue(s.isRefreshing());

        fetcher.complete(snapshot(100));
        assertEquals(2, fetcher.calls());
        assertTrue(s.isRefreshing());
        fetcher.complete(snapshot(300));
        assertFalse(s.isRefreshing());
        assertEquals(1, registry.size());
    }

    @Test
    public void testTickDuringForcedFetch() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100));
        scheduler.advance(29_000);
        s.forceRefresh();
        scheduler.advance(1000);
        // the tick waits for the forced fetch
        assertEquals(2, fetcher.calls());
        fetcher.complete(snapshot(100));
        assertEquals(3, fetcher.calls());
        fetcher.complete(snapshot(100));
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
    }

    @Test
    public void testDisabled() {
        properties.setEnabled(false);
        PollingSubscription s = subscription();
        s.start();
        assertEquals(0, fetcher.calls());
        assertEquals(SubscriptionState.IDLE, s.getState());
        assertEquals(0, scheduler.pendingCount());
    }

    @Test
    public void testListenerFailureDoesNotBreakCycle() {
        PollingSubscription s = new PollingSubscription("sub-1", "server-1/cpu", properties, fetcher, new ChangeDetector(scheduler.getClock()), registry,
                        activity, new RecordingListener() {
                            @Override
                            public void onData(String subscriptionId, List<Sample> samples) {
                                throw new IllegalStateException("listener");
                            }
                        }, scheduler);
        s.start();
        fetcher.complete(snapshot(1));
        assertNotNull(s.getData());
        assertEquals(SubscriptionState.SCHEDULED_WAIT, s.getState());
        assertEquals(1, scheduler.pendingCount());
    }

    /**
     * Activity signal whose events the test delivers by hand, in any order.
     */
    private static class ScriptedActivityState implements ActivityState {

        private final List<ActivityListener> listeners = new ArrayList<>();
        private boolean active = true;

        @Override
        public boolean isActive() {
            return active;
        }

        @Override
        public void addListener(ActivityListener listener) {
            listeners.add(listener);
        }

        @Override
        public void removeListener(ActivityListener listener) {
            listeners.remove(listener);
        }

        void deliver(boolean value) {
            for (ActivityListener l : listeners) {
                l.activityChanged(value);
            }
        }
    }

    @Test
    public void testStaleActivityEventIgnored() {
        ScriptedActivityState scripted = new ScriptedActivityState();
        PollingSubscription s = new PollingSubscription("sub-1", "server-1/cpu", properties, fetcher, new ChangeDetector(scheduler.getClock()),
                        registry, scripted, listener, scheduler);
        s.start();
        fetcher.complete(snapshot(1));

        // the signal went inactive and back to active, the events arrive reversed
        scripted.active = false;
        scripted.active = true;
        scripted.deliver(true);
        scripted.deliver(false);
        assertTrue(s.isVisible());
        assertEquals(30000L, s.currentInterval());
        assertEquals(Collections.singletonList(30000L), scheduler.pendingDelays());
    }

    @Test
    public void testCallbacksRunWithoutLock() {
        AtomicReference<PollingSubscription> ref = new AtomicReference<>();
        List<Boolean> lockHeld = new ArrayList<>();
        PollingSubscription s = new PollingSubscription("sub-1", "server-1/cpu", properties, fetcher, new ChangeDetector(scheduler.getClock()),
                        registry, activity, new SubscriptionListener() {
                            @Override
                            public void onData(String subscriptionId, List<Sample> samples) {
                                lockHeld.add(Thread.holdsLock(ref.get()));
                            }

                            @Override
                            public void onChange(String subscriptionId, ChangeNotification notification) {
                                lockHeld.add(Thread.holdsLock(ref.get()));
                            }

                            @Override
                            public void onError(String subscriptionId, Throwable error, int attempt) {
                                lockHeld.add(Thread.holdsLock(ref.get()));
                            }
                        }, scheduler);
        ref.set(s);
        s.start();
        fetcher.complete(snapshot(100));
        scheduler.advance(30_000);
        fetcher.complete(snapshot(200));
        fetcher.failWith(new FetchException(500, "Fetch failed with status 500", ""));
        s.forceRefresh();
        assertEquals(Arrays.asList(false, false, false, false), lockHeld);
    }

    @Test
    public void testListenerClosingAnotherSubscription() {
        AtomicReference<PollingSubscription> other = new AtomicReference<>();
        PollingSubscription s = new PollingSubscription("sub-1", "server-1/cpu", properties, fetcher, new ChangeDetector(scheduler.getClock()),
                        registry, activity, new SubscriptionListener() {
                            @Override
                            public void onData(String subscriptionId, List<Sample> samples) {
                                other.get().close();
                            }
                        }, scheduler);
        PollingSubscription o = subscription();
        other.set(o);
        s.start();
        fetcher.complete(snapshot(1));
        assertTrue(o.isDisposed());
        assertFalse(s.isDisposed());
    }

    @Test
    public void testSnapshotNotMutatedByConsumers() {
        PollingSubscription s = subscription();
        s.start();
        fetcher.complete(snapshot(100));
        s.getData().get(0).setValue(1000);
        listener.data.get(0).get(0).setValue(1000);
        assertEquals(snapshot(100), s.getData());

        scheduler.advance(30_000);
        fetcher.complete(snapshot(110));
        assertEquals(0, registry.size());
        s.getPreviousData().get(0).setValue(5);
        assertEquals(snapshot(100), s.getPreviousData());
    }
}
