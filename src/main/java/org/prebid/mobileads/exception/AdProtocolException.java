package org.prebid.mobileads.exception;

/**
 * Thrown when data received from the native side does not follow the channel protocol, which means this layer
 * and the native bridge are out of sync.
 */
@SuppressWarnings("serial")
public class AdProtocolException extends RuntimeException {

    public AdProtocolException(String message) {
        super(message);
    }

    public AdProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
