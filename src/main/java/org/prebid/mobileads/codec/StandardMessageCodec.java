package org.prebid.mobileads.codec;

import io.vertx.core.buffer.Buffer;
import org.prebid.mobileads.exception.AdProtocolException;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Binary codec for the values that can cross the native channel.
 * <p>
 * Every value is written as a one byte type tag followed by its content. Supported values are null,
 * {@link Boolean}, {@link Integer}, {@link Long}, {@link Double}, {@link String}, byte arrays, {@link List}s
 * and {@link Map}s of supported values. Subclasses add their own tags by overriding
 * {@link #writeValue(Buffer, Object)} and {@link #readValueOfType(int, BufferReader)}; tags below 128 are
 * reserved for this class.
 */
public class StandardMessageCodec {

    private static final int NULL = 0;
    private static final int TRUE = 1;
    private static final int FALSE = 2;
    private static final int INT = 3;
    private static final int LONG = 4;
    private static final int DOUBLE = 6;
    private static final int STRING = 7;
    private static final int BYTE_ARRAY = 8;
    private static final int LIST = 12;
    private static final int MAP = 13;

    public Buffer encodeMessage(Object message) {
        final Buffer buffer = Buffer.buffer();
        writeValue(buffer, message);
        return buffer;
    }

    public Object decodeMessage(Buffer buffer) {
        final BufferReader reader = new BufferReader(buffer, 0);
        final Object value = readValue(reader);
        ensureFullyRead(reader);
        return value;
    }

    public Buffer encodeMethodCall(MethodCall methodCall) {
        final Buffer buffer = Buffer.buffer();
        writeValue(buffer, methodCall.getMethod());
        writeValue(buffer, methodCall.getArguments());
        return buffer;
    }

    @SuppressWarnings("unchecked")
    public MethodCall decodeMethodCall(Buffer buffer) {
        final BufferReader reader = new BufferReader(buffer, 0);
        final Object method = readValue(reader);
        final Object arguments = readValue(reader);
        ensureFullyRead(reader);

        if (!(method instanceof String)) {
            throw new AdProtocolException("Method call corrupted: method name is not a string");
        }
        if (arguments != null && !(arguments instanceof Map)) {
            throw new AdProtocolException("Method call corrupted: arguments of " + method + " are not a map");
        }
        return MethodCall.of((String) method, (Map<String, Object>) arguments);
    }

    protected void writeValue(Buffer buffer, Object value) {
        if (value == null) {
            writeTag(buffer, NULL);
        } else if (value instanceof Boolean) {
            writeTag(buffer, (Boolean) value ? TRUE : FALSE);
        } else if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
            writeTag(buffer, INT);
            buffer.appendInt(((Number) value).intValue());
        } else if (value instanceof Long) {
            writeTag(buffer, LONG);
            buffer.appendLong((Long) value);
        } else if (value instanceof Double || value instanceof Float) {
            writeTag(buffer, DOUBLE);
            buffer.appendDouble(((Number) value).doubleValue());
        } else if (value instanceof String) {
            writeTag(buffer, STRING);
            writeBytes(buffer, ((String) value).getBytes(StandardCharsets.UTF_8));
        } else if (value instanceof byte[]) {
            writeTag(buffer, BYTE_ARRAY);
            writeBytes(buffer, (byte[]) value);
        } else if (value instanceof List) {
            final List<?> list = (List<?>) value;
            writeTag(buffer, LIST);
            writeSize(buffer, list.size());
            for (Object element : list) {
                writeValue(buffer, element);
            }
        } else if (value instanceof Map) {
            final Map<?, ?> map = (Map<?, ?>) value;
            writeTag(buffer, MAP);
            writeSize(buffer, map.size());
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                writeValue(buffer, entry.getKey());
                writeValue(buffer, entry.getValue());
            }
        } else {
            throw new IllegalArgumentException(String.format(
                    "Unsupported value: '%s' of type '%s'", value, value.getClass().getName()));
        }
    }

    protected final Object readValue(BufferReader reader) {
        return readValueOfType(reader.readUnsignedByte(), reader);
    }

    protected Object readValueOfType(int type, BufferReader reader) {
        switch (type) {
            case NULL:
                return null;
            case TRUE:
                return Boolean.TRUE;
            case FALSE:
                return Boolean.FALSE;
            case INT:
                return reader.readInt();
            case LONG:
                return reader.readLong();
            case DOUBLE:
                return reader.readDouble();
            case STRING:
                return new String(reader.readBytes(readSize(reader)), StandardCharsets.UTF_8);
            case BYTE_ARRAY:
                return reader.readBytes(readSize(reader));
            case LIST:
                final int listSize = readSize(reader);
                // every element takes at least its tag byte
                final List<Object> list = new ArrayList<>(Math.min(listSize, reader.remaining()));
                for (int i = 0; i < listSize; i++) {
                    list.add(readValue(reader));
                }
                return list;
            case MAP:
                final int mapSize = readSize(reader);
                final Map<Object, Object> map = new LinkedHashMap<>();
                for (int i = 0; i < mapSize; i++) {
                    map.put(readValue(reader), readValue(reader));
                }
                return map;
            default:
                throw new AdProtocolException("Message corrupted: unknown type tag " + type);
        }
    }

    /**
     * Reads the next value and checks it is either null or of the given type.
     */
    protected final <T> T readValueAs(BufferReader reader, Class<T> type) {
        final Object value = readValue(reader);
        if (value != null && !type.isInstance(value)) {
            throw new AdProtocolException(String.format("Message corrupted: expected %s but got %s",
                    type.getSimpleName(), value.getClass().getSimpleName()));
        }
        return type.cast(value);
    }

    protected final <T> T readRequiredValueAs(BufferReader reader, Class<T> type) {
        final T value = readValueAs(reader, type);
        if (value == null) {
            throw new AdProtocolException("Message corrupted: missing required " + type.getSimpleName());
        }
        return value;
    }

    protected static void writeTag(Buffer buffer, int type) {
        buffer.appendUnsignedByte((short) type);
    }

    private static void writeSize(Buffer buffer, int size) {
        buffer.appendInt(size);
    }

    private static int readSize(BufferReader reader) {
        final int size = reader.readInt();
        if (size < 0) {
            throw new AdProtocolException("Message corrupted: negative size " + size);
        }
        return size;
    }

    private static void writeBytes(Buffer buffer, byte[] bytes) {
        writeSize(buffer, bytes.length);
        buffer.appendBytes(bytes);
    }

    private static void ensureFullyRead(BufferReader reader) {
        if (reader.hasRemaining()) {
            throw new AdProtocolException("Message corrupted: unexpected trailing bytes");
        }
    }
}
