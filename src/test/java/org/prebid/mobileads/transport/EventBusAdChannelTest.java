package org.prebid.mobileads.transport;

import io.vertx.core.Vertx;
import io.vertx.core.eventbus.ReplyException;
import io.vertx.junit5.VertxExtension;
import io.vertx.junit5.VertxTestContext;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.prebid.mobileads.codec.AdMessageCodec;
import org.prebid.mobileads.codec.MethodCall;
import org.prebid.mobileads.codec.MethodCallMessageCodec;
import org.prebid.mobileads.model.AdSize;

import java.util.Collections;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

@ExtendWith(VertxExtension.class)
public class EventBusAdChannelTest {

    private static final String CHANNEL_NAME = "test.mobile-ads";

    private Vertx vertx;

    private EventBusAdChannel target;

    @BeforeEach
    public void setUp(Vertx vertx) {
        this.vertx = vertx;
        vertx.eventBus().registerDefaultCodec(MethodCall.class, new MethodCallMessageCodec(new AdMessageCodec()));

        target = new EventBusAdChannel(vertx.eventBus(), CHANNEL_NAME, 1000L);
    }

    @Test
    public void invokeMethodShouldDeliverCallToNativeSideAndSucceedOnReply(VertxTestContext context) {
        // given
        vertx.eventBus().<MethodCall>consumer(CHANNEL_NAME, message -> {
            context.verify(() -> assertThat(message.body())
                    .isEqualTo(MethodCall.of("loadBannerAd", Collections.singletonMap("size", AdSize.BANNER))));
            message.reply(null);
        });

        // when and then
        target.invokeMethod("loadBannerAd", Collections.singletonMap("size", AdSize.BANNER))
                .onComplete(context.succeedingThenComplete());
    }

    @Test
    public void invokeMethodShouldFailWhenNativeSideRejectsCall(VertxTestContext context) {
        // given
        vertx.eventBus().<MethodCall>consumer(CHANNEL_NAME, message -> message.fail(1, "no such ad"));

        // when and then
        target.invokeMethod("disposeAd", Collections.singletonMap("adId", 0))
                .onComplete(context.failing(throwable -> context.verify(() -> {
                    assertThat(throwable).isInstanceOf(ReplyException.class).hasMessage("no such ad");
                    context.completeNow();
                })));
    }

    @Test
    public void invokeMethodShouldFailWhenNobodyListens(VertxTestContext context) {
        target.invokeMethod("disposeAd", Collections.singletonMap("adId", 0))
                .onComplete(context.failingThenComplete());
    }

    @Test
    public void setMethodCallHandlerShouldReceiveCallsSentToEventsAddress(VertxTestContext context) {
        // given
        target.setMethodCallHandler(methodCall -> context.verify(() -> {
            assertThat(methodCall.getMethod()).isEqualTo("onAdEvent");
            assertThat(methodCall.getArguments()).containsEntry("adId", 3);
            context.completeNow();
        }));

        // when
        vertx.eventBus().send(EventBusAdChannel.eventsAddress(CHANNEL_NAME),
                MethodCall.of("onAdEvent", Collections.singletonMap("adId", 3)));
    }

    @Test
    public void setMethodCallHandlerShouldReplacePreviousHandler(VertxTestContext context) {
        // given
        final AtomicInteger firstHandlerCalls = new AtomicInteger();
        target.setMethodCallHandler(methodCall -> firstHandlerCalls.incrementAndGet());

        // when
        target.setMethodCallHandler(methodCall -> context.verify(() -> {
            assertThat(firstHandlerCalls.get()).isZero();
            context.completeNow();
        }));

        // then
        vertx.eventBus().send(EventBusAdChannel.eventsAddress(CHANNEL_NAME),
                MethodCall.of("onAdEvent", Collections.emptyMap()));
    }

    @Test
    public void eventsAddressShouldSuffixChannelName() {
        assertThat(EventBusAdChannel.eventsAddress("channel")).isEqualTo("channel/events");
        assertThat(target.name()).isEqualTo(CHANNEL_NAME);
    }
}
