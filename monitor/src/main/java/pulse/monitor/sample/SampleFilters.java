package pulse.monitor.sample;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Collectors;

import com.google.common.base.Preconditions;
import pulse.model.Quality;
import pulse.model.Sample;

public class SampleFilters {

    private SampleFilters() {}

    public static List<Sample> byQuality(List<Sample> samples, Collection<Quality> qualities) {
        Preconditions.checkNotNull(qualities, "qualities");
        return samples.stream().filter(s -> qualities.contains(s.getQuality())).collect(Collectors.toList());
    }

    /**
     * Keeps samples whose timestamp lies in [start, end]. Samples without a timestamp are dropped.
     */
    public static List<Sample> byDateRange(List<Sample> samples, Instant start, Instant end) {
        Preconditions.checkNotNull(start, "start");
        Preconditions.checkNotNull(end, "end");
        return samples.stream().filter(s -> null != s.getTimestamp() && !s.getTimestamp().isBefore(start) && !s.getTimestamp().isAfter(end))
                        .collect(Collectors.toList());
    }
}
