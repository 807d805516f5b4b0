package pulse.subscription;

import java.util.List;

import pulse.model.ChangeNotification;
import pulse.model.Sample;

/**
 * Callbacks fired by a subscription, in order, after the subscription has released its lock.
 * Implementations may call back into any subscription.
 */
public interface SubscriptionListener {

    SubscriptionListener NONE = new SubscriptionListener() {};

    default void onData(String subscriptionId, List<Sample> samples) {}

    default void onChange(String subscriptionId, ChangeNotification notification) {}

    /**
     * @param attempt
     *            the retry about to be made (1 based), or 0 for a failed forced refresh
     */
    default void onError(String subscriptionId, Throwable error, int attempt) {}

    default void onDegraded(String subscriptionId, Throwable error) {}

}
