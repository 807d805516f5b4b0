package pulse.monitor.subscription;

import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pulse.model.ChangeNotification;
import pulse.model.Sample;
import pulse.subscription.SubscriptionListener;

public class LoggingSubscriptionListener implements SubscriptionListener {

    private static final Logger log = LoggerFactory.getLogger(LoggingSubscriptionListener.class);

    @Override
    public void onData(String subscriptionId, List<Sample> samples) {
        log.debug("[{}] {} samples", subscriptionId, samples.size());
    }

    @Override
    public void onChange(String subscriptionId, ChangeNotification notification) {
        log.info("[{}] {} changed {}% from {} to {} ({})", subscriptionId, notification.getMetricId(), notification.getChangePercent(),
                        notification.getPreviousValue(), notification.getCurrentValue(), notification.getSeverity().getLabel());
    }

    @Override
    public void onError(String subscriptionId, Throwable error, int attempt) {
        log.debug("[{}] Fetch failed before attempt {}: {}", subscriptionId, attempt, error.getMessage());
    }

    @Override
    public void onDegraded(String subscriptionId, Throwable error) {
        log.warn("[{}] Degraded: {}", subscriptionId, error.getMessage());
    }
}
