package pulse.client.http;

import java.net.URI;
import java.net.URISyntaxException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.apache.commons.lang3.builder.ToStringBuilder;
import org.apache.http.client.utils.URIBuilder;

import com.google.common.base.Preconditions;

/**
 * Read of one data series: GET /resource/{resourceId}/series/{seriesId}/data
 */
public class SeriesQuery {

    public static final char KEY_SEPARATOR = '/';

    private final String resourceId;
    private final String seriesId;
    private Instant startDate;
    private Instant endDate;
    private SeriesAggregation aggregation = SeriesAggregation.RAW;

    public SeriesQuery(String resourceId, String seriesId) {
        Preconditions.checkArgument(StringUtils.isNotBlank(resourceId), "resourceId must not be blank");
        Preconditions.checkArgument(StringUtils.isNotBlank(seriesId), "seriesId must not be blank");
        this.resourceId = resourceId;
        this.seriesId = seriesId;
    }

    /**
     * Parses a metric key of the form {resourceId}/{seriesId}.
     */
    public static SeriesQuery fromMetricKey(String metricKey) {
        Preconditions.checkArgument(metricKey != null, "metricKey must not be null");
        int idx = metricKey.indexOf(KEY_SEPARATOR);
        Preconditions.checkArgument(idx > 0 && idx < metricKey.length() - 1, "metricKey must look like resourceId/seriesId: %s", metricKey);
        return new SeriesQuery(metricKey.substring(0, idx), metricKey.substring(idx + 1));
    }

    public String getResourceId() {
        return resourceId;
    }

    public String getSeriesId() {
        return seriesId;
    }

    public Instant getStartDate() {
        return startDate;
    }

    public SeriesQuery setStartDate(Instant startDate) {
        this.startDate = startDate;
        return this;
    }

    public Instant getEndDate() {
        return endDate;
    }

    public SeriesQuery setEndDate(Instant endDate) {
        this.endDate = endDate;
        return this;
    }

    public SeriesAggregation getAggregation() {
        return aggregation;
    }

    public SeriesQuery setAggregation(SeriesAggregation aggregation) {
        this.aggregation = aggregation;
        return this;
    }

    public URI toUri(String baseUrl) throws URISyntaxException {
        URIBuilder builder = new URIBuilder(baseUrl);
        List<String> segments = new ArrayList<>();
        for (String s : builder.getPathSegments()) {
            if (!s.isEmpty()) {
                segments.add(s);
            }
        }
        segments.add("resource");
        segments.add(resourceId);
        segments.add("series");
        segments.add(seriesId);
        segments.add("data");
        builder.setPathSegments(segments);
        if (null != startDate) {
            builder.addParameter("startDate", startDate.toString());
        }
        if (null != endDate) {
            builder.addParameter("endDate", endDate.toString());
        }
        if (null != aggregation && aggregation != SeriesAggregation.RAW) {
            builder.addParameter("aggregation", aggregation.getParameter());
        }
        return builder.build();
    }

    @Override
    public String toString() {
        ToStringBuilder tsb = new ToStringBuilder(this);
        tsb.append("resourceId", resourceId);
        tsb.append("seriesId", seriesId);
        tsb.append("startDate", startDate);
        tsb.append("endDate", endDate);
        tsb.append("aggregation", aggregation);
        return tsb.toString();
    }
}
