package org.prebid.mobileads.codec;

import io.vertx.core.buffer.Buffer;
import io.vertx.core.eventbus.EventBus;
import io.vertx.core.eventbus.MessageCodec;

import java.util.Objects;

/**
 * {@link EventBus} codec for {@link MethodCall}s exchanged with the native bridge.
 * <p>
 * Local delivery goes through the wire encoding too, so a receiver never shares instances with the sender
 * and only sees values the {@link AdMessageCodec} can represent.
 */
public class MethodCallMessageCodec implements MessageCodec<MethodCall, MethodCall> {

    private static final String CODEC_NAME = "MethodCallMessageCodec";

    private final StandardMessageCodec codec;

    public MethodCallMessageCodec(StandardMessageCodec codec) {
        this.codec = Objects.requireNonNull(codec);
    }

    @Override
    public void encodeToWire(Buffer buffer, MethodCall methodCall) {
        final Buffer encoded = codec.encodeMethodCall(methodCall);
        buffer.appendInt(encoded.length());
        buffer.appendBuffer(encoded);
    }

    @Override
    public MethodCall decodeFromWire(int pos, Buffer buffer) {
        final int length = buffer.getInt(pos);
        final int start = pos + Integer.BYTES;
        return codec.decodeMethodCall(buffer.getBuffer(start, start + length));
    }

    @Override
    public MethodCall transform(MethodCall methodCall) {
        return codec.decodeMethodCall(codec.encodeMethodCall(methodCall));
    }

    @Override
    public String name() {
        return codecName();
    }

    @Override
    public byte systemCodecID() {
        return -1;
    }

    public static String codecName() {
        return CODEC_NAME;
    }
}
