package pulse.subscription;

public enum SubscriptionState {

    IDLE, FETCHING, SCHEDULED_WAIT, RETRYING, DEGRADED, DISPOSED

}
