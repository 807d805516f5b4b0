package pulse.monitor.subscription;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import pulse.subscription.Subscription;

/**
 * Holds a set of independent subscriptions keyed by id and answers aggregate questions about them.
 */
public class MultiMetricCoordinator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MultiMetricCoordinator.class);

    private final SubscriptionFactory factory;
    private final Map<String,Subscription> subscriptions = new LinkedHashMap<>();
    private boolean closed = false;

    public MultiMetricCoordinator(SubscriptionFactory factory) {
        this.factory = factory;
    }

    /**
     * Creates and registers a subscription for the metric key. It is not started.
     */
    public Subscription register(String id, String metricKey) {
        Preconditions.checkState(null != factory, "No subscription factory configured");
        return register(factory.create(id, metricKey));
    }

    public synchronized Subscription register(Subscription subscription) {
        Preconditions.checkNotNull(subscription, "subscription");
        Preconditions.checkState(!closed, "Coordinator is closed");
        Preconditions.checkArgument(!subscriptions.containsKey(subscription.getId()), "Subscription %s already registered", subscription.getId());
        subscriptions.put(subscription.getId(), subscription);
        log.debug("Registered subscription {} for {}", subscription.getId(), subscription.getMetricKey());
        return subscription;
    }

    /**
     * Removes and closes the subscription.
     *
     * @return false if no subscription with the id was registered
     */
    public boolean remove(String id) {
        Subscription s;
        synchronized (this) {
            s = subscriptions.remove(id);
        }
        if (null == s) {
            return false;
        }
        s.close();
        log.debug("Removed subscription {}", id);
        return true;
    }

    public synchronized Subscription get(String id) {
        return subscriptions.get(id);
    }

    public synchronized List<Subscription> getSubscriptions() {
        return new ArrayList<>(subscriptions.values());
    }

    public synchronized int size() {
        return subscriptions.size();
    }

    public void startAll() {
        for (Subscription s : getSubscriptions()) {
            try {
                s.start();
            } catch (RuntimeException e) {
                log.error("[{}] Error starting subscription", s.getId(), e);
            }
        }
    }

    /**
     * Requests a refresh of every live subscription. A failing subscription does not stop the others.
     */
    public void refreshAll() {
        for (Subscription s : getSubscriptions()) {
            if (s.isDisposed()) {
                continue;
            }
            try {
                s.refresh();
            } catch (RuntimeException e) {
                log.error("[{}] Error refreshing subscription", s.getId(), e);
            }
        }
    }

    public boolean isAnyLoading() {
        return getSubscriptions().stream().anyMatch(Subscription::isLoading);
    }

    public boolean isAnyError() {
        return getSubscriptions().stream().anyMatch(s -> null != s.getError());
    }

    public boolean isAnyRefreshing() {
        return getSubscriptions().stream().anyMatch(Subscription::isRefreshing);
    }

    @Override
    public void close() {
        List<Subscription> toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = new ArrayList<>(subscriptions.values());
            subscriptions.clear();
        }
        for (Subscription s : toClose) {
            try {
                s.close();
            } catch (RuntimeException e) {
                log.error("[{}] Error closing subscription", s.getId(), e);
            }
        }
        log.info("Closed {} subscriptions", toClose.size());
    }
}
