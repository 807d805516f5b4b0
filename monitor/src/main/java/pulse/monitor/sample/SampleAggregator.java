package pulse.monitor.sample;

import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import pulse.model.Sample;

/**
 * Calendar bucketing of samples. Buckets are evaluated in UTC unless a zone is given.
 */
public class SampleAggregator {

    private static final Logger log = LoggerFactory.getLogger(SampleAggregator.class);

    private SampleAggregator() {}

    public static List<Sample> aggregate(List<Sample> samples, Interval interval) {
        return aggregate(samples, interval, ZoneOffset.UTC);
    }

    public static List<Sample> aggregate(List<Sample> samples, Interval interval, ZoneId zone) {
        return aggregate(samples, interval, zone, Aggregator.AVG);
    }

    public static List<Sample> aggregate(List<Sample> samples, Interval interval, ZoneId zone, Aggregator aggregator) {
        Aggregation aggregation = new Aggregation(interval, zone, aggregator);
        int skipped = 0;
        for (Sample s : samples) {
            if (SampleValidator.isValid(s)) {
                aggregation.add(s);
            } else {
                skipped++;
            }
        }
        if (skipped > 0) {
            log.debug("Skipped {} invalid samples while aggregating by {}", skipped, interval.getName());
        }
        List<Sample> result = new ArrayList<>(aggregation.size());
        aggregation.forEach(result::add);
        return result;
    }
}
