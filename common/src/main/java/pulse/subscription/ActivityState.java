package pulse.subscription;

/**
 * Foreground / background signal used to pick a polling cadence.
 */
public interface ActivityState {

    boolean isActive();

    void addListener(ActivityListener listener);

    void removeListener(ActivityListener listener);

}
