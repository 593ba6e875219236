package org.prebid.mobileads.listener;

import lombok.Builder;
import lombok.Value;
import org.prebid.mobileads.ad.Ad;

/**
 * Callbacks for events of an ad showing or dismissing full screen content. Every callback may be null.
 */
@Builder(toBuilder = true)
@Value
public class FullScreenContentCallback<A extends Ad> {

    AdEventCallback<A> onAdShowedFullScreenContent;

    AdEventCallback<A> onAdImpression;

    AdErrorCallback<A> onAdFailedToShowFullScreenContent;

    AdEventCallback<A> onAdWillDismissFullScreenContent;

    AdEventCallback<A> onAdDismissedFullScreenContent;
}
