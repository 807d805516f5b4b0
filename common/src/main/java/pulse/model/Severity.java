package pulse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Severity {

    LOW("low"), MEDIUM("medium"), HIGH("high");

    public static final double MEDIUM_THRESHOLD = 25.0;
    public static final double HIGH_THRESHOLD = 50.0;

    private final String label;

    Severity(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    /**
     * @param changePercent
     *            magnitude of a relative change, in percent
     * @return the severity class of the change
     */
    public static Severity of(double changePercent) {
        if (changePercent >= HIGH_THRESHOLD) {
            return HIGH;
        }
        if (changePercent >= MEDIUM_THRESHOLD) {
            return MEDIUM;
        }
        return LOW;
    }

    @JsonCreator
    public static Severity fromLabel(String label) {
        for (Severity s : values()) {
            if (s.label.equalsIgnoreCase(label)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown severity: " + label);
    }
}
