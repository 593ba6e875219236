package org.prebid.mobileads.spring.config;

import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
public class MobileAdsProperties {

    /**
     * Name of the channel shared with the native bridge.
     */
    private String channelName = "prebid.mobile-ads";

    /**
     * Time to wait for the native side to accept a call.
     */
    private long sendTimeoutMs = 30_000L;

    /**
     * Dispose ads right after their load failure is reported, instead of leaving it to the application.
     */
    private boolean disposeOnLoadFailure;
}
