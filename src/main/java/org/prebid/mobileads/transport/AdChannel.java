package org.prebid.mobileads.transport;

import io.vertx.core.Future;
import io.vertx.core.Handler;
import org.prebid.mobileads.codec.MethodCall;

import java.util.Map;

/**
 * Bidirectional channel to the native ads bridge.
 */
public interface AdChannel {

    /**
     * Name identifying the channel on both sides.
     */
    String name();

    /**
     * Invokes the native method with the given arguments.
     * <p>
     * The returned future succeeds as soon as the native side accepts the call for asynchronous processing
     * and fails if it rejects it or cannot be reached.
     */
    Future<Void> invokeMethod(String method, Map<String, Object> arguments);

    /**
     * Subscribes the handler to method calls made by the native side, replacing the previous one.
     * A null handler unsubscribes.
     */
    void setMethodCallHandler(Handler<MethodCall> handler);
}
