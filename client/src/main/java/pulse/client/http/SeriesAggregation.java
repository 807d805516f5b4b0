package pulse.client.http;

/**
 * Server side aggregation requested along with a series read.
 */
public enum SeriesAggregation {

    RAW("raw"), HOURLY("hourly"), DAILY("daily"), WEEKLY("weekly"), MONTHLY("monthly");

    private final String parameter;

    SeriesAggregation(String parameter) {
        this.parameter = parameter;
    }

    public String getParameter() {
        return parameter;
    }

    public static SeriesAggregation fromParameter(String parameter) {
        for (SeriesAggregation a : values()) {
            if (a.parameter.equalsIgnoreCase(parameter)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown aggregation: " + parameter);
    }
}
