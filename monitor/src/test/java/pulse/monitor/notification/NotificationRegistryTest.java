package pulse.monitor.notification;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

import org.junit.Before;
import org.junit.Test;

import pulse.common.configuration.NotificationProperties;
import pulse.model.ChangeNotification;
import pulse.model.Severity;
import pulse.monitor.ManualScheduledExecutor;

public class NotificationRegistryTest {

    private ManualScheduledExecutor time;
    private NotificationRegistry registry;

    @Before
    public void setup() {
        time = new ManualScheduledExecutor();
        registry = new NotificationRegistry(new NotificationProperties(), time.getClock());
    }

    private static ChangeNotification notification(String metricId, double current) {
        return new ChangeNotification(metricId, 100, current, Math.abs(current - 100), Instant.parse("2024-03-05T12:00:00Z"), Severity.of(Math.abs(current - 100)));
    }

    private List<String> metricIds() {
        return registry.getNotifications().stream().map(ChangeNotification::getMetricId).collect(Collectors.toList());
    }

    @Test
    public void testOnePerMetric() {
        registry.add(notification("a", 130));
        registry.add(notification("b", 130));
        registry.add(notification("a", 160));
        assertEquals(2, registry.size());
        assertEquals(160.0, registry.get("a").getCurrentValue(), 0.0);
        // the replacement is the newest entry
        assertEquals(List.of("b", "a"), metricIds());
    }

    @Test
    public void testCapEvictsOldest() {
        for (int i = 0; i < 10; i++) {
            registry.add(notification("m" + i, 130));
            time.advance(10);
        }
        assertEquals(10, registry.size());
        registry.add(notification("m10", 130));
        assertEquals(10, registry.size());
        assertNull(registry.get("m0"));
        assertEquals("m1", metricIds().get(0));
        assertEquals("m10", metricIds().get(9));
    }

    @Test
    public void testSweep() {
        registry.add(notification("a", 130));
        time.advance(10_000);
        registry.add(notification("b", 130));
        time.advance(19_999);
        assertEquals(0, registry.sweep());
        time.advance(1);
        assertEquals(1, registry.sweep());
        assertEquals(List.of("b"), metricIds());
        time.advance(10_000);
        assertEquals(1, registry.sweep());
        assertEquals(0, registry.size());
    }

    @Test
    public void testReplacementResetsAge() {
        registry.add(notification("a", 130));
        time.advance(25_000);
        registry.add(notification("a", 170));
        time.advance(25_000);
        registry.sweep();
        assertEquals(170.0, registry.get("a").getCurrentValue(), 0.0);
    }

    @Test
    public void testDismissAndClear() {
        registry.add(notification("a", 130));
        registry.add(notification("b", 130));
        registry.dismiss("a");
        registry.dismiss("a");
        registry.dismiss("unknown");
        assertEquals(List.of("b"), metricIds());
        registry.clear();
        assertEquals(0, registry.size());
        assertTrue(registry.getNotifications().isEmpty());
    }

    @Test
    public void testNotificationsAreCopied() {
        registry.add(notification("a", 130));
        List<ChangeNotification> copy = registry.getNotifications();
        registry.clear();
        assertEquals(1, copy.size());
    }

    @Test
    public void testSmallCap() {
        NotificationRegistry small = new NotificationRegistry(2, Duration.ofSeconds(1), Duration.ofSeconds(1), time.getClock());
        small.add(notification("a", 130));
        small.add(notification("b", 130));
        small.add(notification("c", 130));
        assertEquals(2, small.size());
        assertNull(small.get("a"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidCap() {
        new NotificationRegistry(0, Duration.ofSeconds(1), Duration.ofSeconds(1), time.getClock());
    }

    @Test
    public void testStartAndShutdown() {
        assertFalse(registry.isRunning());
        registry.start();
        registry.start();
        assertTrue(registry.isRunning());
        registry.shutdown();
        assertFalse(registry.isRunning());
        registry.shutdown();
    }
}
