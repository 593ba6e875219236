package org.prebid.mobileads.spring.config;

import org.junit.jupiter.api.Test;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.transport.AdChannel;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;

import static org.assertj.core.api.Assertions.assertThat;

public class MobileAdsConfigurationTest {

    private final ApplicationContextRunner contextRunner = new ApplicationContextRunner()
            .withUserConfiguration(MobileAdsConfiguration.class);

    @Test
    public void contextShouldUseDefaultPropertiesWhenNoneAreSet() {
        contextRunner.run(context -> {
            assertThat(context).hasSingleBean(AdInstanceManager.class);

            final MobileAdsProperties properties = context.getBean(MobileAdsProperties.class);
            assertThat(properties.getChannelName()).isEqualTo("prebid.mobile-ads");
            assertThat(properties.getSendTimeoutMs()).isEqualTo(30_000L);
            assertThat(properties.isDisposeOnLoadFailure()).isFalse();
        });
    }

    @Test
    public void contextShouldBindMobileAdsProperties() {
        contextRunner
                .withPropertyValues(
                        "mobile-ads.channel-name=custom.channel",
                        "mobile-ads.send-timeout-ms=500",
                        "mobile-ads.dispose-on-load-failure=true")
                .run(context -> {
                    final MobileAdsProperties properties = context.getBean(MobileAdsProperties.class);
                    assertThat(properties.getSendTimeoutMs()).isEqualTo(500L);
                    assertThat(properties.isDisposeOnLoadFailure()).isTrue();

                    assertThat(context.getBean(AdChannel.class).name()).isEqualTo("custom.channel");
                    assertThat(context.getBean(AdInstanceManager.class).channelName()).isEqualTo("custom.channel");
                });
    }
}
