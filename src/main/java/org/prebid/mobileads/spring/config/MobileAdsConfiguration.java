package org.prebid.mobileads.spring.config;

import io.vertx.core.Vertx;
import org.prebid.mobileads.codec.AdMessageCodec;
import org.prebid.mobileads.codec.MethodCall;
import org.prebid.mobileads.codec.MethodCallMessageCodec;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.transport.AdChannel;
import org.prebid.mobileads.transport.EventBusAdChannel;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties
public class MobileAdsConfiguration {

    @Bean
    @ConfigurationProperties(prefix = "mobile-ads")
    MobileAdsProperties mobileAdsProperties() {
        return new MobileAdsProperties();
    }

    @Bean(destroyMethod = "close")
    Vertx vertx() {
        return Vertx.vertx();
    }

    @Bean
    AdMessageCodec adMessageCodec() {
        return new AdMessageCodec();
    }

    @Bean
    MethodCallMessageCodec methodCallMessageCodec(Vertx vertx, AdMessageCodec adMessageCodec) {
        final MethodCallMessageCodec messageCodec = new MethodCallMessageCodec(adMessageCodec);
        vertx.eventBus().registerDefaultCodec(MethodCall.class, messageCodec);
        return messageCodec;
    }

    @Bean
    AdChannel adChannel(Vertx vertx,
                        @SuppressWarnings("unused") MethodCallMessageCodec methodCallMessageCodec,
                        MobileAdsProperties mobileAdsProperties) {

        return new EventBusAdChannel(
                vertx.eventBus(),
                mobileAdsProperties.getChannelName(),
                mobileAdsProperties.getSendTimeoutMs());
    }

    @Bean(destroyMethod = "close")
    AdInstanceManager adInstanceManager(AdChannel adChannel,
                                        MobileAdsProperties mobileAdsProperties,
                                        @Value("${logging.sampling-rate:0.01}") double logSamplingRate) {

        return new AdInstanceManager(adChannel, mobileAdsProperties.isDisposeOnLoadFailure(), logSamplingRate);
    }
}
