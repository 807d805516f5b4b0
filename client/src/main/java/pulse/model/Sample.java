package pulse.model;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.Objects;

/**
 * A Sample is one timestamped value of a metric together with a quality tag.
 *
 * Json example:
 * {"id":"s1","metricId":"cpu","value":1.5,"timestamp":"2024-01-01T00:00:00Z","quality":"good"}
 *
 * Samples are transport objects and may carry invalid data (missing metricId or timestamp,
 * non-finite value). Use SampleValidator before trusting them.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"id", "metricId", "value", "timestamp", "quality"})
public class Sample {

    private String id;
    private String metricId;
    private double value;
    private Instant timestamp;
    private Quality quality = Quality.GOOD;

    public Sample() {}

    public Sample(Sample other) {
        this.id = other.getId();
        this.metricId = other.getMetricId();
        this.value = other.getValue();
        this.timestamp = other.getTimestamp();
        this.quality = other.getQuality();
    }

    public Sample(String id, String metricId, double value, Instant timestamp, Quality quality) {
        this.id = id;
        this.metricId = metricId;
        this.value = value;
        this.timestamp = timestamp;
        this.quality = quality;
    }

    public static Builder newBuilder() {
        return new Builder();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getMetricId() {
        return metricId;
    }

    public void setMetricId(String metricId) {
        this.metricId = metricId;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Quality getQuality() {
        return quality;
    }

    public void setQuality(Quality quality) {
        this.quality = quality;
    }

    /**
     * @return a copy of this sample carrying a different value
     */
    public Sample withValue(double newValue) {
        Sample copy = new Sample(this);
        copy.setValue(newValue);
        return copy;
    }

    @Override
    public String toString() {
        return "Sample{" + "id='" + id + '\'' + ", metricId='" + metricId + '\'' + ", value=" + value + ", timestamp=" + timestamp + ", quality="
                        + quality + '}';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (o == null || getClass() != o.getClass())
            return false;

        Sample other = (Sample) o;
        return Double.compare(value, other.value) == 0 && Objects.equal(id, other.id) && Objects.equal(metricId, other.metricId)
                        && Objects.equal(timestamp, other.timestamp) && quality == other.quality;
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id, metricId, value, timestamp, quality);
    }

    /**
     * Simple Builder for Sample. Note: cannot re-use a builder after build is called.
     */
    public static class Builder {

        private final Sample sample;

        private Builder() {
            sample = new Sample();
        }

        public Builder id(String id) {
            sample.setId(id);
            return this;
        }

        public Builder metricId(String metricId) {
            sample.setMetricId(metricId);
            return this;
        }

        public Builder value(double value) {
            sample.setValue(value);
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            sample.setTimestamp(timestamp);
            return this;
        }

        public Builder timestamp(String isoTimestamp) {
            sample.setTimestamp(Instant.parse(isoTimestamp));
            return this;
        }

        public Builder quality(Quality quality) {
            sample.setQuality(quality);
            return this;
        }

        public Sample build() {
            return sample;
        }
    }
}
