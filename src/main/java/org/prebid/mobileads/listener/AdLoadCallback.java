package org.prebid.mobileads.listener;

import lombok.Value;
import org.prebid.mobileads.ad.Ad;

import java.util.Objects;

/**
 * Receives the outcome of loading a full screen ad. Both callbacks are required.
 */
@Value
public class AdLoadCallback<A extends Ad> {

    AdEventCallback<A> onAdLoaded;

    AdLoadErrorCallback<A> onAdFailedToLoad;

    private AdLoadCallback(AdEventCallback<A> onAdLoaded, AdLoadErrorCallback<A> onAdFailedToLoad) {
        this.onAdLoaded = Objects.requireNonNull(onAdLoaded);
        this.onAdFailedToLoad = Objects.requireNonNull(onAdFailedToLoad);
    }

    public static <A extends Ad> AdLoadCallback<A> of(AdEventCallback<A> onAdLoaded,
                                                       AdLoadErrorCallback<A> onAdFailedToLoad) {
        return new AdLoadCallback<>(onAdLoaded, onAdFailedToLoad);
    }
}
