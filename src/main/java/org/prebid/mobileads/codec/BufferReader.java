package org.prebid.mobileads.codec;

import io.vertx.core.buffer.Buffer;
import org.prebid.mobileads.exception.AdProtocolException;

import java.util.Objects;

/**
 * Sequential reader over a {@link Buffer}, failing with {@link AdProtocolException} on truncated input.
 */
public class BufferReader {

    private final Buffer buffer;
    private int position;

    public BufferReader(Buffer buffer, int position) {
        this.buffer = Objects.requireNonNull(buffer);
        this.position = position;
    }

    public int readUnsignedByte() {
        ensureAvailable(Byte.BYTES);
        final int value = buffer.getUnsignedByte(position);
        position += Byte.BYTES;
        return value;
    }

    public int readInt() {
        ensureAvailable(Integer.BYTES);
        final int value = buffer.getInt(position);
        position += Integer.BYTES;
        return value;
    }

    public long readLong() {
        ensureAvailable(Long.BYTES);
        final long value = buffer.getLong(position);
        position += Long.BYTES;
        return value;
    }

    public double readDouble() {
        ensureAvailable(Double.BYTES);
        final double value = buffer.getDouble(position);
        position += Double.BYTES;
        return value;
    }

    public byte[] readBytes(int length) {
        ensureAvailable(length);
        final byte[] value = buffer.getBytes(position, position + length);
        position += length;
        return value;
    }

    public boolean hasRemaining() {
        return position < buffer.length();
    }

    public int remaining() {
        return buffer.length() - position;
    }

    private void ensureAvailable(int length) {
        if (length < 0 || length > remaining()) {
            throw new AdProtocolException("Message corrupted: unexpected end of buffer at position " + position);
        }
    }
}
