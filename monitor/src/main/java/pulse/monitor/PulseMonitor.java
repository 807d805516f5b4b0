package pulse.monitor;

import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.builder.SpringApplicationBuilder;

@SpringBootApplication(scanBasePackages = {"pulse.monitor", "pulse.common"})
public class PulseMonitor {

    public static void main(String[] args) {
        new SpringApplicationBuilder(PulseMonitor.class).main(PulseMonitor.class).web(WebApplicationType.NONE).run(args);
    }
}
