package pulse.monitor.configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;

import javax.net.ssl.SSLContext;

import org.apache.http.impl.client.CloseableHttpClient;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import pulse.client.SampleFetcher;
import pulse.client.http.HttpClient;
import pulse.client.http.HttpSampleFetcher;
import pulse.client.http.SeriesAggregation;
import pulse.common.configuration.HttpClientProperties;
import pulse.common.configuration.NotificationProperties;
import pulse.common.configuration.SubscriptionProperties;
import pulse.monitor.detect.ChangeDetector;
import pulse.monitor.notification.NotificationRegistry;
import pulse.monitor.subscription.LoggingSubscriptionListener;
import pulse.monitor.subscription.MultiMetricCoordinator;
import pulse.monitor.subscription.SubscriptionFactory;
import pulse.subscription.ActivityState;
import pulse.subscription.ManualActivityState;
import pulse.subscription.SubscriptionListener;
import pulse.util.RequestRateLimiter;

@Configuration
@EnableConfigurationProperties({MonitorProperties.class})
public class PulseMonitorConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean(destroyMethod = "shutdownNow")
    public ScheduledExecutorService pollingScheduler(MonitorProperties monitorProperties) {
        return Executors.newScheduledThreadPool(monitorProperties.getSchedulerThreads(),
                        new ThreadFactoryBuilder().setNameFormat("pulse-poll-%d").setDaemon(true).build());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService fetchExecutor(HttpClientProperties httpClientProperties) {
        return Executors.newFixedThreadPool(httpClientProperties.getThreads(), new ThreadFactoryBuilder().setNameFormat("pulse-fetch-%d").setDaemon(true).build());
    }

    @Bean(destroyMethod = "close")
    @ConditionalOnMissingBean
    public CloseableHttpClient httpClient(HttpClientProperties httpClientProperties) {
        SSLContext ssl = HttpClient.getSSLContext(httpClientProperties.getTrustStoreFile(), httpClientProperties.getTrustStorePassword());
        return HttpClient.get(ssl, httpClientProperties.getConnectTimeout(), httpClientProperties.getSocketTimeout(),
                        httpClientProperties.isHostVerificationEnabled());
    }

    @Bean
    public RequestRateLimiter requestRateLimiter(HttpClientProperties httpClientProperties, Clock clock) {
        return new RequestRateLimiter(httpClientProperties.getMaxRequestsPerWindow(), Duration.ofMillis(httpClientProperties.getRateLimitWindow()),
                        httpClientProperties.getMaxTrackedKeys(), clock);
    }

    @Bean
    @ConditionalOnMissingBean
    public SampleFetcher sampleFetcher(CloseableHttpClient httpClient, @Qualifier("fetchExecutor") ExecutorService fetchExecutor,
                    RequestRateLimiter requestRateLimiter, HttpClientProperties httpClientProperties, Clock clock) {
        return new HttpSampleFetcher(httpClient, httpClientProperties.getBaseUrl(), fetchExecutor, Duration.ofMillis(httpClientProperties.getLookback()),
                        SeriesAggregation.fromParameter(httpClientProperties.getAggregation()), requestRateLimiter, clock);
    }

    @Bean
    public ChangeDetector changeDetector(Clock clock) {
        return new ChangeDetector(clock);
    }

    @Bean(destroyMethod = "shutdown")
    public NotificationRegistry notificationRegistry(NotificationProperties notificationProperties, Clock clock) {
        NotificationRegistry registry = new NotificationRegistry(notificationProperties, clock);
        registry.start();
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public ActivityState activityState() {
        // a headless monitor is always in the foreground
        return new ManualActivityState(true);
    }

    @Bean
    @ConditionalOnMissingBean
    public SubscriptionListener subscriptionListener() {
        return new LoggingSubscriptionListener();
    }

    @Bean
    public SubscriptionFactory subscriptionFactory(SubscriptionProperties subscriptionProperties, SampleFetcher sampleFetcher, ChangeDetector changeDetector,
                    NotificationRegistry notificationRegistry, ActivityState activityState, SubscriptionListener subscriptionListener,
                    @Qualifier("pollingScheduler") ScheduledExecutorService pollingScheduler) {
        return new SubscriptionFactory(subscriptionProperties, sampleFetcher, changeDetector, notificationRegistry, activityState, subscriptionListener,
                        pollingScheduler);
    }

    @Bean(destroyMethod = "close")
    public MultiMetricCoordinator multiMetricCoordinator(SubscriptionFactory subscriptionFactory, MonitorProperties monitorProperties) {
        MultiMetricCoordinator coordinator = new MultiMetricCoordinator(subscriptionFactory);
        for (MonitorProperties.MetricTarget target : monitorProperties.getMetrics()) {
            coordinator.register(target.getId(), target.getKey());
        }
        coordinator.startAll();
        return coordinator;
    }
}
