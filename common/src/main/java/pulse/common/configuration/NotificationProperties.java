package pulse.common.configuration;

import javax.validation.constraints.Min;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pulse.notifications")
public class NotificationProperties {

    @Min(1)
    private int maxNotifications = 10;
    @Min(1)
    private long ttl = 30000;
    @Min(1)
    private long sweepInterval = 5000;

    public int getMaxNotifications() {
        return maxNotifications;
    }

    public void setMaxNotifications(int maxNotifications) {
        this.maxNotifications = maxNotifications;
    }

    public long getTtl() {
        return ttl;
    }

    public void setTtl(long ttl) {
        this.ttl = ttl;
    }

    public long getSweepInterval() {
        return sweepInterval;
    }

    public void setSweepInterval(long sweepInterval) {
        this.sweepInterval = sweepInterval;
    }
}
