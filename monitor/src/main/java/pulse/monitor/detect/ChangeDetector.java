package pulse.monitor.detect;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import pulse.model.ChangeNotification;
import pulse.model.Sample;
import pulse.model.Severity;

/**
 * Compares two consecutive snapshots metric by metric. A metric produces a notification when its relative change, rounded to two
 * decimals, reaches the threshold. Metrics missing from the previous snapshot or with a previous value of zero are skipped.
 */
public class ChangeDetector {

    private static final Logger log = LoggerFactory.getLogger(ChangeDetector.class);

    private final Clock clock;

    public ChangeDetector(Clock clock) {
        this.clock = Preconditions.checkNotNull(clock, "clock");
    }

    /**
     * @param threshold
     *            minimum change in percent
     * @return notifications in the order the metrics appear in the current snapshot
     */
    public List<ChangeNotification> detect(List<Sample> previous, List<Sample> current, double threshold) {
        if (null == previous || previous.isEmpty() || null == current || current.isEmpty()) {
            return Collections.emptyList();
        }
        Map<String,Sample> before = lastByMetric(previous);
        Map<String,Sample> after = lastByMetric(current);
        Instant now = clock.instant();
        List<ChangeNotification> notifications = new ArrayList<>();
        for (Map.Entry<String,Sample> e : after.entrySet()) {
            Sample prev = before.get(e.getKey());
            if (null == prev || prev.getValue() == 0) {
                continue;
            }
            double prevValue = prev.getValue();
            double currValue = e.getValue().getValue();
            double changePercent = changePercent(prevValue, currValue);
            if (!Double.isFinite(changePercent) || changePercent < threshold) {
                continue;
            }
            ChangeNotification n = new ChangeNotification(e.getKey(), prevValue, currValue, changePercent, now, Severity.of(changePercent));
            log.trace("Detected change {}", n);
            notifications.add(n);
        }
        return notifications;
    }

    static double changePercent(double previous, double current) {
        double raw = Math.abs(current - previous) / Math.abs(previous) * 100;
        if (!Double.isFinite(raw)) {
            return raw;
        }
        return BigDecimal.valueOf(raw).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    private static Map<String,Sample> lastByMetric(List<Sample> samples) {
        Map<String,Sample> byMetric = new LinkedHashMap<>();
        for (Sample s : samples) {
            if (null != s && null != s.getMetricId()) {
                byMetric.put(s.getMetricId(), s);
            }
        }
        return byMetric;
    }
}
