package pulse.common.configuration;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties({SubscriptionProperties.class, NotificationProperties.class, HttpClientProperties.class})
public class PulseCommonConfiguration {

}
