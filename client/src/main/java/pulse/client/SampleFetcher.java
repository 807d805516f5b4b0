package pulse.client;

import java.util.List;
import java.util.concurrent.CompletableFuture;

import pulse.model.Sample;

/**
 * Source of metric snapshots. Implementations must not block the calling thread; a failed
 * fetch is reported by completing the returned future exceptionally.
 */
@FunctionalInterface
public interface SampleFetcher {

    /**
     * @param metricKey
     *            opaque key identifying the series to fetch
     * @return future completed with the samples of the series, in source order
     */
    CompletableFuture<List<Sample>> fetch(String metricKey);

}
