package org.prebid.mobileads.listener;

import lombok.Builder;
import lombok.Value;
import org.prebid.mobileads.ad.Ad;
import org.prebid.mobileads.ad.NativeAd;

@Builder(toBuilder = true)
@Value
public class NativeAdListener implements AdWithViewListener {

    AdEventCallback<Ad> onAdLoaded;

    AdLoadErrorCallback<Ad> onAdFailedToLoad;

    AdEventCallback<Ad> onAdOpened;

    AdEventCallback<Ad> onAdWillDismissScreen;

    AdEventCallback<Ad> onAdClosed;

    AdEventCallback<Ad> onAdImpression;

    AdEventCallback<NativeAd> onNativeAdClicked;
}
