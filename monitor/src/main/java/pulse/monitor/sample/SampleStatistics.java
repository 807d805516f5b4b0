package pulse.monitor.sample;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.base.Objects;
import pulse.model.Sample;

public class SampleStatistics {

    public static final double DEFAULT_OUTLIER_THRESHOLD = 2.0D;

    private SampleStatistics() {}

    public static class Change {

        private final double value;
        private final double percentage;

        public Change(double value, double percentage) {
            this.value = value;
            this.percentage = percentage;
        }

        public double getValue() {
            return value;
        }

        public double getPercentage() {
            return percentage;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o)
                return true;
            if (o == null || getClass() != o.getClass())
                return false;
            Change other = (Change) o;
            return Double.compare(value, other.value) == 0 && Double.compare(percentage, other.percentage) == 0;
        }

        @Override
        public int hashCode() {
            return Objects.hashCode(value, percentage);
        }

        @Override
        public String toString() {
            ToStringBuilder tsb = new ToStringBuilder(this);
            tsb.append("value", value);
            tsb.append("percentage", percentage);
            return tsb.toString();
        }
    }

    public static Change calculateChange(double current, double previous) {
        double change = current - previous;
        double percentage = previous != 0 ? (change / previous) * 100 : 0;
        return new Change(change, percentage);
    }

    public static List<Sample> findOutliers(List<Sample> samples) {
        return findOutliers(samples, DEFAULT_OUTLIER_THRESHOLD);
    }

    /**
     * Uses the population standard deviation of the sample values. The comparison is inclusive ({@code >=}) rather than strict, so a sample
     * lying exactly {@code thresholdStdDev} deviations from the mean counts as an outlier: in {@code [10, 10, 10, 10, 100]} the value 100
     * sits exactly two deviations out and is reported. A series without spread has no outliers.
     */
    public static List<Sample> findOutliers(List<Sample> samples, double thresholdStdDev) {
        if (samples.isEmpty()) {
            return Collections.emptyList();
        }
        double mean = 0;
        for (Sample s : samples) {
            mean += s.getValue();
        }
        mean /= samples.size();
        double variance = 0;
        for (Sample s : samples) {
            variance += Math.pow(s.getValue() - mean, 2);
        }
        double stdDev = Math.sqrt(variance / samples.size());
        if (stdDev == 0) {
            return Collections.emptyList();
        }
        final double m = mean;
        return samples.stream().filter(s -> Math.abs(s.getValue() - m) >= thresholdStdDev * stdDev).collect(Collectors.toList());
    }

    /**
     * Min-max scales values to [0, 1]. The input is returned as is when all values are equal.
     */
    public static List<Sample> normalize(List<Sample> samples) {
        if (samples.isEmpty()) {
            return samples;
        }
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (Sample s : samples) {
            min = Math.min(min, s.getValue());
            max = Math.max(max, s.getValue());
        }
        double range = max - min;
        if (range == 0) {
            return samples;
        }
        final double lo = min;
        return samples.stream().map(s -> s.withValue((s.getValue() - lo) / range)).collect(Collectors.toList());
    }
}
