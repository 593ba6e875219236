package org.prebid.mobileads.transport;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import io.vertx.core.eventbus.DeliveryOptions;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageConsumer;
import org.apache.commons.lang3.StringUtils;
import org.prebid.mobileads.codec.MethodCall;
import org.prebid.mobileads.codec.MethodCallMessageCodec;
import org.prebid.mobileads.log.ConditionalLogger;
import org.prebid.mobileads.log.Logger;
import org.prebid.mobileads.log.LoggerFactory;

import java.util.Map;
import java.util.Objects;

/**
 * {@link AdChannel} on top of Vert.x {@link EventBus}.
 * <p>
 * Outgoing calls are sent as requests to the channel name and are accepted once the native side replies.
 * Incoming calls are consumed from the channel name suffixed with {@code /events}. Both directions are encoded
 * with {@link MethodCallMessageCodec}, which must be registered as the default codec of {@link MethodCall}.
 */
public class EventBusAdChannel implements AdChannel {

    private static final Logger logger = LoggerFactory.getLogger(EventBusAdChannel.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    // a missing native side fails every call, so only one rejection in this many is logged per method
    private static final int REJECTION_LOG_LIMIT = 100;

    private static final String EVENTS_ADDRESS_SUFFIX = "/events";

    private final EventBus eventBus;
    private final String name;
    private final DeliveryOptions deliveryOptions;

    private MessageConsumer<MethodCall> consumer;

    public EventBusAdChannel(EventBus eventBus, String name, long sendTimeoutMs) {
        this.eventBus = Objects.requireNonNull(eventBus);
        this.name = Objects.requireNonNull(name);
        this.deliveryOptions = new DeliveryOptions().setSendTimeout(sendTimeoutMs);
    }

    public static String eventsAddress(String channelName) {
        return channelName + EVENTS_ADDRESS_SUFFIX;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public Future<Void> invokeMethod(String method, Map<String, Object> arguments) {
        logger.debug("Invoking {} on channel {}", method, name);

        return eventBus.request(name, MethodCall.of(method, arguments), deliveryOptions)
                .onFailure(throwable -> logRejection(method, throwable))
                .mapEmpty();
    }

    private void logRejection(String method, Throwable throwable) {
        final String reason = StringUtils.defaultIfBlank(throwable.getMessage(), throwable.getClass().getSimpleName());
        conditionalLogger.warnWithKey(
                name + "#" + method,
                String.format("Native side rejected %s on channel %s: %s", method, name, reason),
                REJECTION_LOG_LIMIT);
    }

    @Override
    public synchronized void setMethodCallHandler(Handler<MethodCall> handler) {
        if (consumer != null) {
            consumer.unregister();
            consumer = null;
        }
        if (handler != null) {
            consumer = eventBus.consumer(eventsAddress(name), message -> handler.handle(message.body()));
        }
    }
}
