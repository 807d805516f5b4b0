package pulse.monitor.sample;

public enum MetricType {

    NUMERIC("numeric", "Numeric"), PERCENTAGE("percentage", "Percentage"), CURRENCY("currency", "Currency"), COUNT("count", "Count");

    private final String name;
    private final String label;

    MetricType(String name, String label) {
        this.name = name;
        this.label = label;
    }

    public String getName() {
        return name;
    }

    public String getLabel() {
        return label;
    }

    public static MetricType fromName(String name) {
        for (MetricType t : values()) {
            if (t.name.equalsIgnoreCase(name)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown metric type: " + name);
    }
}
