package pulse.subscription;

import java.util.List;

import pulse.model.Sample;

/**
 * Live polling session keeping one metric's snapshot fresh.
 */
public interface Subscription {

    String getId();

    String getMetricKey();

    /**
     * Performs the first fetch and starts the polling timer. Has no effect when disabled or closed.
     */
    void start();

    /**
     * Requests an out-of-band fetch. Coalesced with a fetch that is already in progress.
     */
    void refresh();

    /**
     * Always performs one more fetch, independent of the retry state.
     */
    void forceRefresh();

    /**
     * Cancels the timer and discards the result of any fetch still in flight. Irreversible.
     */
    void close();

    List<Sample> getData();

    boolean isLoading();

    boolean isFetching();

    Throwable getError();

    boolean isRefreshing();

    int getRetryCount();

    boolean isVisible();

    SubscriptionState getState();

    boolean isDisposed();

}
