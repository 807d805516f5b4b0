package pulse.monitor.subscription;

import java.util.concurrent.ScheduledExecutorService;

import pulse.client.SampleFetcher;
import pulse.common.configuration.SubscriptionProperties;
import pulse.monitor.detect.ChangeDetector;
import pulse.monitor.notification.NotificationRegistry;
import pulse.subscription.ActivityState;
import pulse.subscription.SubscriptionListener;

/**
 * Builds subscriptions that share one fetcher, registry, activity signal and scheduler.
 */
public class SubscriptionFactory {

    private final SubscriptionProperties properties;
    private final SampleFetcher fetcher;
    private final ChangeDetector detector;
    private final NotificationRegistry registry;
    private final ActivityState activity;
    private final SubscriptionListener listener;
    private final ScheduledExecutorService scheduler;

    public SubscriptionFactory(SubscriptionProperties properties, SampleFetcher fetcher, ChangeDetector detector, NotificationRegistry registry,
                    ActivityState activity, SubscriptionListener listener, ScheduledExecutorService scheduler) {
        this.properties = properties;
        this.fetcher = fetcher;
        this.detector = detector;
        this.registry = registry;
        this.activity = activity;
        this.listener = listener;
        this.scheduler = scheduler;
    }

    public PollingSubscription create(String id, String metricKey) {
        return new PollingSubscription(id, metricKey, properties, fetcher, detector, registry, activity, listener, scheduler);
    }
}
