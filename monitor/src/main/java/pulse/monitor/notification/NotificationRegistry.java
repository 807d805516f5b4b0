package pulse.monitor.notification;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.StampedLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import pulse.common.configuration.NotificationProperties;
import pulse.model.ChangeNotification;

/**
 * Bounded store of live change notifications, at most one per metric. Entries expire after a fixed time to live and the oldest entry is
 * evicted when the store is full.
 */
public class NotificationRegistry {

    private static final Logger log = LoggerFactory.getLogger(NotificationRegistry.class);

    private static class Entry {

        private final ChangeNotification notification;
        private final Instant created;

        Entry(ChangeNotification notification, Instant created) {
            this.notification = notification;
            this.created = created;
        }
    }

    private final int maxNotifications;
    private final Duration ttl;
    private final Duration sweepInterval;
    private final Clock clock;
    // insertion ordered, so the first entry is always the oldest
    private final Map<String,Entry> entries = new LinkedHashMap<>();
    private final StampedLock lock = new StampedLock();
    private ScheduledExecutorService executorService = null;

    public NotificationRegistry(NotificationProperties properties, Clock clock) {
        this(properties.getMaxNotifications(), Duration.ofMillis(properties.getTtl()), Duration.ofMillis(properties.getSweepInterval()), clock);
    }

    public NotificationRegistry(int maxNotifications, Duration ttl, Duration sweepInterval, Clock clock) {
        Preconditions.checkArgument(maxNotifications > 0, "maxNotifications must be positive");
        Preconditions.checkArgument(!ttl.isNegative() && !ttl.isZero(), "ttl must be positive");
        Preconditions.checkArgument(!sweepInterval.isNegative() && !sweepInterval.isZero(), "sweepInterval must be positive");
        this.maxNotifications = maxNotifications;
        this.ttl = ttl;
        this.sweepInterval = sweepInterval;
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    public void add(ChangeNotification notification) {
        Preconditions.checkNotNull(notification, "notification");
        long stamp = lock.writeLock();
        try {
            entries.remove(notification.getMetricId());
            entries.put(notification.getMetricId(), new Entry(notification, clock.instant()));
            Iterator<Map.Entry<String,Entry>> iter = entries.entrySet().iterator();
            while (entries.size() > maxNotifications && iter.hasNext()) {
                String evicted = iter.next().getKey();
                iter.remove();
                log.debug("Evicted notification for {}, registry full", evicted);
            }
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * Removes every entry whose age has reached the time to live.
     *
     * @return the number of entries removed
     */
    public int sweep() {
        int removed = 0;
        long stamp = lock.writeLock();
        try {
            Instant now = clock.instant();
            Iterator<Entry> iter = entries.values().iterator();
            while (iter.hasNext()) {
                Entry e = iter.next();
                if (Duration.between(e.created, now).compareTo(ttl) >= 0) {
                    iter.remove();
                    removed++;
                }
            }
        } finally {
            lock.unlockWrite(stamp);
        }
        if (removed > 0) {
            log.debug("Expired {} notifications", removed);
        }
        return removed;
    }

    public void dismiss(String metricId) {
        long stamp = lock.writeLock();
        try {
            entries.remove(metricId);
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    public void clear() {
        long stamp = lock.writeLock();
        try {
            entries.clear();
        } finally {
            lock.unlockWrite(stamp);
        }
    }

    /**
     * @return a copy of the live notifications, oldest first
     */
    public List<ChangeNotification> getNotifications() {
        long stamp = lock.readLock();
        try {
            List<ChangeNotification> result = new ArrayList<>(entries.size());
            entries.values().forEach(e -> result.add(e.notification));
            return result;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public ChangeNotification get(String metricId) {
        long stamp = lock.readLock();
        try {
            Entry e = entries.get(metricId);
            return null == e ? null : e.notification;
        } finally {
            lock.unlockRead(stamp);
        }
    }

    public int size() {
        long stamp = lock.readLock();
        try {
            return entries.size();
        } finally {
            lock.unlockRead(stamp);
        }
    }

    /**
     * Starts the periodic expiry sweep.
     */
    public synchronized void start() {
        if (null != executorService) {
            return;
        }
        ThreadFactory threadFactory = new ThreadFactoryBuilder().setNameFormat("notification-sweep-%d").setDaemon(true).build();
        executorService = Executors.newSingleThreadScheduledExecutor(threadFactory);
        executorService.scheduleAtFixedRate(() -> {
            try {
                sweep();
            } catch (RuntimeException e) {
                log.error("Error sweeping notifications", e);
            }
        }, sweepInterval.toMillis(), sweepInterval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("Started notification sweep every {} ms, ttl {} ms", sweepInterval.toMillis(), ttl.toMillis());
    }

    public synchronized boolean isRunning() {
        return null != executorService;
    }

    public synchronized void shutdown() {
        if (null == executorService) {
            return;
        }
        executorService.shutdownNow();
        executorService = null;
        log.info("Stopped notification sweep");
    }
}
