package pulse.model;

import java.time.Instant;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;
import com.google.common.base.Preconditions;

/**
 * A significant change of one metric between two consecutive snapshots.
 */
@JsonPropertyOrder({"metricId", "previousValue", "currentValue", "changePercent", "timestamp", "severity"})
public class ChangeNotification {

    private final String metricId;
    private final double previousValue;
    private final double currentValue;
    private final double changePercent;
    private final Instant timestamp;
    private final Severity severity;

    @JsonCreator
    public ChangeNotification(@JsonProperty("metricId") String metricId, @JsonProperty("previousValue") double previousValue,
                    @JsonProperty("currentValue") double currentValue, @JsonProperty("changePercent") double changePercent,
                    @JsonProperty("timestamp") Instant timestamp, @JsonProperty("severity") Severity severity) {
        Preconditions.checkNotNull(metricId, "metricId");
        Preconditions.checkArgument(changePercent >= 0, "changePercent cannot be negative");
        this.metricId = metricId;
        this.previousValue = previousValue;
        this.currentValue = currentValue;
        this.changePercent = changePercent;
        this.timestamp = timestamp;
        this.severity = severity;
    }

    public String getMetricId() {
        return metricId;
    }

    public double getPreviousValue() {
        return previousValue;
    }

    public double getCurrentValue() {
        return currentValue;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public Severity getSeverity() {
        return severity;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;
        ChangeNotification other = (ChangeNotification) o;
        return Double.compare(previousValue, other.previousValue) == 0 && Double.compare(currentValue, other.currentValue) == 0
                        && Double.compare(changePercent, other.changePercent) == 0 && metricId.equals(other.metricId)
                        && Objects.equal(timestamp, other.timestamp) && severity == other.severity;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(metricId, previousValue, currentValue, changePercent, timestamp, severity);
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("metricId", metricId);
        tsb.append("previousValue", previousValue);
        tsb.append("currentValue", currentValue);
        tsb.append("changePercent", changePercent);
        tsb.append("timestamp", timestamp);
        tsb.append("severity", severity);
        return tsb.toString();
    }
}
