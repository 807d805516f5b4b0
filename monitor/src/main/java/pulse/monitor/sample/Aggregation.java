package pulse.monitor.sample;

import java.time.ZoneId;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;

import org.apache.commons.lang3.builder.ToStringBuilder;

import com.google.common.base.Preconditions;
import pulse.model.Quality;
import pulse.model.Sample;

/**
 * Groups samples into calendar buckets and folds each bucket with an {@link Aggregator}. Buckets are iterated in the order they were
 * first seen.
 */
public class Aggregation implements Iterable<Sample> {

    public static final String ID_SUFFIX = "-aggregated";

    public static class AggregatedValue {

        private int count = 0;
        private double value = 0.0D;
        private boolean allGood = true;
        private final Sample first;

        AggregatedValue(Sample first) {
            this.first = first;
        }

        public void incrementCount() {
            count++;
        }

        public int getCount() {
            return count;
        }

        public double getValue() {
            return value;
        }

        public void setValue(double value) {
            this.value = value;
        }

        public boolean isAllGood() {
            return allGood;
        }

        public Sample getFirst() {
            return first;
        }

        @Override
        public String toString() {
            StringBuilder buf = new StringBuilder();
            buf.append("{count: ").append(this.count);
            buf.append(" value: ").append(this.value);
            buf.append(" allGood: ").append(this.allGood).append("}");
            return buf.toString();
        }
    }

    protected final Aggregator aggregator;
    protected final Interval interval;
    protected final ZoneId zone;
    protected final Map<String,AggregatedValue> buckets = new LinkedHashMap<>();

    public Aggregation(Interval interval, ZoneId zone, Aggregator agg) {
        Preconditions.checkNotNull(interval, "Interval cannot be null");
        Preconditions.checkNotNull(zone, "Zone cannot be null");
        Preconditions.checkNotNull(agg, "Aggregator cannot be null");
        this.interval = interval;
        this.zone = zone;
        this.aggregator = agg;
    }

    /**
     * Adds a sample with a timestamp to its bucket.
     */
    public void add(Sample sample) {
        Preconditions.checkArgument(null != sample.getTimestamp(), "sample has no timestamp");
        String key = interval.bucketKey(sample.getTimestamp(), zone);
        AggregatedValue val = buckets.get(key);
        if (null == val) {
            buckets.put(key, val = new AggregatedValue(sample));
        }
        val.setValue(aggregator.aggregate(val.getValue(), val.getCount(), sample.getValue()));
        val.incrementCount();
        if (sample.getQuality() != Quality.GOOD) {
            val.allGood = false;
        }
    }

    public int size() {
        return buckets.size();
    }

    @Override
    public Iterator<Sample> iterator() {
        return new Iterator<Sample>() {

            final Iterator<Map.Entry<String,AggregatedValue>> entries = buckets.entrySet().iterator();

            @Override
            public boolean hasNext() {
                return entries.hasNext();
            }

            @Override
            public Sample next() {
                Map.Entry<String,AggregatedValue> e = entries.next();
                AggregatedValue val = e.getValue();
                Sample first = val.getFirst();
                return Sample.newBuilder().id(e.getKey() + ID_SUFFIX).metricId(first.getMetricId())
                                .value(aggregator.last(val.getValue(), val.getCount())).timestamp(first.getTimestamp())
                                .quality(val.isAllGood() ? Quality.GOOD : Quality.WARNING).build();
            }
        };
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("aggregator", this.aggregator);
        tsb.append("interval", this.interval);
        tsb.append("zone", this.zone);
        tsb.append("buckets", this.buckets);
        return tsb.toString();
    }
}
