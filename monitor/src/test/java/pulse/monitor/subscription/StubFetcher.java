package pulse.monitor.subscription;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import pulse.client.SampleFetcher;
import pulse.model.Sample;

/**
 * Hands out futures the test completes. When a failure is set every fetch fails immediately.
 */
class StubFetcher implements SampleFetcher {

    private final List<CompletableFuture<List<Sample>>> requests = new ArrayList<>();
    private Throwable failure = null;

    @Override
    public CompletableFuture<List<Sample>> fetch(String metricKey) {
        CompletableFuture<List<Sample>> f = new CompletableFuture<>();
        requests.add(f);
        if (null != failure) {
            f.completeExceptionally(failure);
        }
        return f;
    }

    void failWith(Throwable failure) {
        this.failure = failure;
    }

    int calls() {
        return requests.size();
    }

    void complete(List<Sample> samples) {
        requests.get(requests.size() - 1).complete(samples);
    }

    void fail(Throwable t) {
        requests.get(requests.size() - 1).completeExceptionally(t);
    }
}
