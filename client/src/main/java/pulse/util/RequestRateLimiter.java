package pulse.util;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.TimeUnit;

import com.google.common.base.Preconditions;
import com.google.common.base.Ticker;
import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;

/**
 * Sliding window request limiter keyed by an identifier. At most {@code maxTrackedKeys}
 * identifiers are remembered; the least recently used one is forgotten first, and an
 * identifier idle for a whole window is dropped.
 */
public class RequestRateLimiter {

    private final int maxRequests;
    private final long windowMillis;
    private final Clock clock;
    private final Cache<String,Deque<Long>> requestLog;

    public RequestRateLimiter(int maxRequests, Duration window, int maxTrackedKeys) {
        this(maxRequests, window, maxTrackedKeys, Clock.systemUTC());
    }

    public RequestRateLimiter(int maxRequests, Duration window, int maxTrackedKeys, Clock clock) {
        Preconditions.checkArgument(maxRequests >= 1, "maxRequests cannot be < 1");
        Preconditions.checkArgument(!window.isNegative() && !window.isZero(), "window must be positive");
        Preconditions.checkArgument(maxTrackedKeys >= 1, "maxTrackedKeys cannot be < 1");
        this.maxRequests = maxRequests;
        this.windowMillis = window.toMillis();
        this.clock = Preconditions.checkNotNull(clock, "clock");
        // single segment so that size eviction is strictly least recently used
        this.requestLog = CacheBuilder.newBuilder().concurrencyLevel(1).maximumSize(maxTrackedKeys)
                        .expireAfterAccess(windowMillis, TimeUnit.MILLISECONDS).ticker(new Ticker() {

                            @Override
                            public long read() {
                                return TimeUnit.MILLISECONDS.toNanos(clock.millis());
                            }
                        }).build();
    }

    /**
     * Records a request for the identifier if it is still under its limit.
     *
     * @return true if the request is allowed, false if the window is full
     */
    public synchronized boolean tryAcquire(String identifier) {
        long now = clock.millis();
        long windowStart = now - windowMillis;
        Deque<Long> requests = requestLog.getIfPresent(identifier);
        if (null == requests) {
            requests = new ArrayDeque<>();
            requestLog.put(identifier, requests);
        }
        while (!requests.isEmpty() && requests.peekFirst() <= windowStart) {
            requests.pollFirst();
        }
        if (requests.size() >= maxRequests) {
            return false;
        }
        requests.addLast(now);
        return true;
    }

    public synchronized long getTrackedKeyCount() {
        requestLog.cleanUp();
        return requestLog.size();
    }

    public synchronized boolean isTracked(String identifier) {
        return requestLog.asMap().containsKey(identifier);
    }

    public synchronized void reset() {
        requestLog.invalidateAll();
    }
}
