package pulse.monitor.sample;

/**
 * Folds the values of one bucket into a single value. Each function is fed the running value, the number of values folded so far and
 * the next value, then finishes with {@link #last(double, int)}.
 */
public enum Aggregator {

    AVG("avg") {
        @Override
        public double aggregate(double current, int count, double update) {
            return current + update;
        }

        @Override
        public double last(double current, int count) {
            return count == 0 ? 0.0D : current / count;
        }
    },
    SUM("sum") {
        @Override
        public double aggregate(double current, int count, double update) {
            return current + update;
        }

        @Override
        public double last(double current, int count) {
            return current;
        }
    },
    MIN("min") {
        @Override
        public double aggregate(double current, int count, double update) {
            return count == 0 ? update : Math.min(current, update);
        }

        @Override
        public double last(double current, int count) {
            return current;
        }
    },
    MAX("max") {
        @Override
        public double aggregate(double current, int count, double update) {
            return count == 0 ? update : Math.max(current, update);
        }

        @Override
        public double last(double current, int count) {
            return current;
        }
    },
    COUNT("count") {
        @Override
        public double aggregate(double current, int count, double update) {
            return count + 1;
        }

        @Override
        public double last(double current, int count) {
            return count;
        }
    };

    private final String name;

    Aggregator(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    /**
     * @param current
     *            last returned value from aggregate, or zero
     * @param count
     *            the number of items aggregated previously into current
     * @param update
     *            a new value to incorporate
     * @return the combination of update and current
     */
    public abstract double aggregate(double current, int count, double update);

    /**
     * @param current
     *            the last value returned from aggregate
     * @param count
     *            the number of values in the aggregate
     * @return the final value of the bucket
     */
    public abstract double last(double current, int count);

    /**
     * @return the aggregator registered under the name, or null if there is none
     */
    public static Aggregator getAggregator(String aggregatorName) {
        if (aggregatorName == null) {
            return null;
        }
        for (Aggregator a : values()) {
            if (a.name.equals(aggregatorName)) {
                return a;
            }
        }
        return null;
    }
}
