package pulse.subscription;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Activity signal driven by explicit calls. Listeners are notified on transitions only.
 */
public class ManualActivityState implements ActivityState {

    private static final Logger log = LoggerFactory.getLogger(ManualActivityState.class);

    private final List<ActivityListener> listeners = new CopyOnWriteArrayList<>();
    private volatile boolean active;

    public ManualActivityState(boolean active) {
        this.active = active;
    }

    @Override
    public boolean isActive() {
        return active;
    }

    public void setActive(boolean active) {
        synchronized (this) {
            if (this.active == active) {
                return;
            }
            this.active = active;
        }
        log.debug("Activity changed to {}", active ? "active" : "inactive");
        for (ActivityListener l : listeners) {
            try {
                l.activityChanged(active);
            } catch (RuntimeException e) {
                log.error("Error notifying activity listener", e);
            }
        }
    }

    @Override
    public void addListener(ActivityListener listener) {
        listeners.add(listener);
    }

    @Override
    public void removeListener(ActivityListener listener) {
        listeners.remove(listener);
    }
}
