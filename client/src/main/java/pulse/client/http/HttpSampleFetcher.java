package pulse.client.http;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

import org.apache.commons.lang3.StringUtils;
import org.apache.http.HttpHeaders;
import org.apache.http.client.methods.CloseableHttpResponse;
import org.apache.http.client.methods.HttpGet;
import org.apache.http.impl.client.CloseableHttpClient;
import org.apache.http.util.EntityUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.common.base.Preconditions;
import pulse.client.FetchException;
import pulse.client.SampleFetcher;
import pulse.model.Sample;
import pulse.serialize.JsonSerializer;
import pulse.util.RequestRateLimiter;

/**
 * Fetches a series over HTTP. Metric keys have the form {resourceId}/{seriesId}; each fetch reads
 * the window [now - lookback, now] and runs on the supplied executor.
 */
public class HttpSampleFetcher implements SampleFetcher {

    private static final Logger log = LoggerFactory.getLogger(HttpSampleFetcher.class);
    private static final ObjectMapper om = JsonSerializer.getObjectMapper();
    private static final TypeReference<List<Sample>> SAMPLE_LIST = new TypeReference<>() {};

    private final CloseableHttpClient client;
    private final String baseUrl;
    private final Executor executor;
    private final Duration lookback;
    private final SeriesAggregation aggregation;
    private final RequestRateLimiter rateLimiter;
    private final Clock clock;

    public HttpSampleFetcher(CloseableHttpClient client, String baseUrl, Executor executor, Duration lookback, SeriesAggregation aggregation,
                    RequestRateLimiter rateLimiter, Clock clock) {
        Preconditions.checkArgument(StringUtils.isNotBlank(baseUrl), "baseUrl must not be blank");
        this.client = Preconditions.checkNotNull(client, "client");
        this.baseUrl = baseUrl;
        this.executor = Preconditions.checkNotNull(executor, "executor");
        this.lookback = Preconditions.checkNotNull(lookback, "lookback");
        this.aggregation = aggregation;
        this.rateLimiter = rateLimiter;
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    @Override
    public CompletableFuture<List<Sample>> fetch(String metricKey) {
        SeriesQuery query;
        try {
            query = SeriesQuery.fromMetricKey(metricKey);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(new FetchException(400, "Invalid metric key", metricKey, e));
        }
        if (null != rateLimiter && !rateLimiter.tryAcquire(metricKey)) {
            log.debug("Rate limit reached for {}", metricKey);
            return CompletableFuture.failedFuture(new FetchException(FetchException.RATE_LIMITED, "Rate limited", metricKey));
        }
        Instant end = clock.instant();
        query.setStartDate(end.minus(lookback)).setEndDate(end).setAggregation(aggregation);
        return CompletableFuture.supplyAsync(() -> {
            try {
                return execute(query);
            } catch (FetchException e) {
                throw new CompletionException(e);
            }
        }, executor);
    }

    List<Sample> execute(SeriesQuery query) throws FetchException {
        URI uri;
        try {
            uri = query.toUri(baseUrl);
        } catch (URISyntaxException e) {
            throw new FetchException(400, "Invalid request URI", query.toString(), e);
        }
        HttpGet get = new HttpGet(uri);
        get.setHeader(HttpHeaders.ACCEPT, "application/json");
        log.trace("Requesting {}", uri);
        try (CloseableHttpResponse response = client.execute(get)) {
            int status = response.getStatusLine().getStatusCode();
            String body = null == response.getEntity() ? "" : EntityUtils.toString(response.getEntity(), StandardCharsets.UTF_8);
            if (status < 200 || status >= 300) {
                throw new FetchException(status, "Fetch failed with status " + status, body);
            }
            if (StringUtils.isBlank(body)) {
                return new ArrayList<>();
            }
            List<Sample> samples = om.readValue(body, SAMPLE_LIST);
            log.debug("Fetched {} samples from {}", samples.size(), uri);
            return samples;
        } catch (IOException e) {
            throw new FetchException(FetchException.IO_ERROR, "Error reading " + uri, e.getMessage(), e);
        }
    }
}
