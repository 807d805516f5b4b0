package pulse.subscription;

@FunctionalInterface
public interface ActivityListener {

    void activityChanged(boolean active);

}
