package org.prebid.mobileads.model;

import lombok.Value;

/**
 * Options for server-to-server reward callbacks of rewarded ads.
 */
@Value(staticConstructor = "of")
public class ServerSideVerificationOptions {

    String userId;

    String customData;
}
