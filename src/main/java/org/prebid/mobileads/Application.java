package org.prebid.mobileads;

import org.prebid.mobileads.spring.config.MobileAdsConfiguration;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.builder.SpringApplicationBuilder;
import org.springframework.context.ConfigurableApplicationContext;

@SuppressWarnings("checkstyle:hideutilityclassconstructor")
public class Application {

    public static void main(String[] args) {
        run(args);
    }

    /**
     * Starts the bridge with properties from {@code application.yaml}, overridable by command line arguments.
     */
    public static ConfigurableApplicationContext run(String... args) {
        return new SpringApplicationBuilder(MobileAdsConfiguration.class)
                .web(WebApplicationType.NONE)
                .run(args);
    }
}
