package pulse.common.configuration;

import javax.validation.constraints.DecimalMin;
import javax.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pulse.subscription")
public class SubscriptionProperties {

    private boolean enabled = true;
    @Min(1)
    private long pollingInterval = 30000;
    @Min(1)
    private long backgroundPollingInterval = 120000;
    @DecimalMin("0.0")
    private double changeThreshold = 20.0;
    @Min(0)
    private int maxRetries = 3;
    @Min(1)
    private long retryDelay = 1000;
    @Min(1)
    private long maxRetryDelay = 30000;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public long getPollingInterval() {
        return pollingInterval;
    }

    public void setPollingInterval(long pollingInterval) {
        this.pollingInterval = pollingInterval;
    }

    public long getBackgroundPollingInterval() {
        return backgroundPollingInterval;
    }

    public void setBackgroundPollingInterval(long backgroundPollingInterval) {
        this.backgroundPollingInterval = backgroundPollingInterval;
    }

    public double getChangeThreshold() {
        return changeThreshold;
    }

    public void setChangeThreshold(double changeThreshold) {
        this.changeThreshold = changeThreshold;
    }

    public int getMaxRetries() {
        return maxRetries;
    }

    public void setMaxRetries(int maxRetries) {
        this.maxRetries = maxRetries;
    }

    public long getRetryDelay() {
        return retryDelay;
    }

    public void setRetryDelay(long retryDelay) {
        this.retryDelay = retryDelay;
    }

    public long getMaxRetryDelay() {
        return maxRetryDelay;
    }

    public void setMaxRetryDelay(long maxRetryDelay) {
        this.maxRetryDelay = maxRetryDelay;
    }
}
