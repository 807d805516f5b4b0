package pulse.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum Quality {

    GOOD("good"), WARNING("warning"), ERROR("error");

    private final String label;

    Quality(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }

    @JsonCreator
    public static Quality fromLabel(String label) {
        if (label == null) {
            return null;
        }
        for (Quality q : values()) {
            if (q.label.equalsIgnoreCase(label)) {
                return q;
            }
        }
        throw new IllegalArgumentException("Unknown quality: " + label);
    }
}
