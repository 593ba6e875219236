package org.prebid.mobileads.codec;

import lombok.Value;

import java.util.Map;

/**
 * A named invocation with its arguments, in either direction of the native channel.
 */
@Value(staticConstructor = "of")
public class MethodCall {

    String method;

    Map<String, Object> arguments;
}
