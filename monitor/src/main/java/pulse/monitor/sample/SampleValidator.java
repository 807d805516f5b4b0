package pulse.monitor.sample;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

import pulse.model.Sample;

/**
 * Reports problems with sample data instead of throwing.
 */
public class SampleValidator {

    private SampleValidator() {}

    public static ValidationResult validate(List<Sample> samples) {
        List<String> errors = new ArrayList<>();
        if (null == samples) {
            errors.add("Data must not be null");
            return ValidationResult.of(errors);
        }
        if (samples.isEmpty()) {
            errors.add("Data cannot be empty");
            return ValidationResult.of(errors);
        }
        for (int i = 0; i < samples.size(); i++) {
            Sample s = samples.get(i);
            if (null == s) {
                errors.add("Sample " + i + " is null");
                continue;
            }
            if (!Double.isFinite(s.getValue())) {
                errors.add("Sample " + i + " has invalid value: " + s.getValue());
            }
            if (null == s.getTimestamp()) {
                errors.add("Sample " + i + " is missing timestamp");
            }
            if (StringUtils.isBlank(s.getMetricId())) {
                errors.add("Sample " + i + " is missing metricId");
            }
        }
        return ValidationResult.of(errors);
    }

    public static boolean isValid(Sample s) {
        return null != s && Double.isFinite(s.getValue()) && null != s.getTimestamp() && StringUtils.isNotBlank(s.getMetricId());
    }

    /**
     * @param min
     *            inclusive lower bound, or null for none
     * @param max
     *            inclusive upper bound, or null for none
     */
    public static boolean validateValue(double value, MetricType type, Double min, Double max) {
        if (!Double.isFinite(value)) {
            return false;
        }
        if (null != min && value < min) {
            return false;
        }
        if (null != max && value > max) {
            return false;
        }
        if (type == MetricType.PERCENTAGE && (value < 0 || value > 100)) {
            return false;
        }
        return true;
    }
}
