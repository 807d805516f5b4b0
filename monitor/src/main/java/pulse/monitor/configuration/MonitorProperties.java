package pulse.monitor.configuration;

import java.util.ArrayList;
import java.util.List;

import javax.validation.Valid;
import javax.validation.constraints.Min;
import javax.validation.constraints.NotBlank;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "pulse.monitor")
public class MonitorProperties {

    @Min(1)
    private int schedulerThreads = 2;
    @Valid
    private List<MetricTarget> metrics = new ArrayList<>();

    public int getSchedulerThreads() {
        return schedulerThreads;
    }

    public void setSchedulerThreads(int schedulerThreads) {
        this.schedulerThreads = schedulerThreads;
    }

    public List<MetricTarget> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<MetricTarget> metrics) {
        this.metrics = metrics;
    }

    public static class MetricTarget {

        @NotBlank
        private String id;
        // resourceId/seriesId
        @NotBlank
        private String key;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getKey() {
            return key;
        }

        public void setKey(String key) {
            this.key = key;
        }
    }
}
