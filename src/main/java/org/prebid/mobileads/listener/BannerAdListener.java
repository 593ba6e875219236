package org.prebid.mobileads.listener;

import lombok.Builder;
import lombok.Value;
import org.prebid.mobileads.ad.Ad;

@Builder(toBuilder = true)
@Value
public class BannerAdListener implements AdWithViewListener {

    AdEventCallback<Ad> onAdLoaded;

    AdLoadErrorCallback<Ad> onAdFailedToLoad;

    AdEventCallback<Ad> onAdOpened;

    AdEventCallback<Ad> onAdWillDismissScreen;

    AdEventCallback<Ad> onAdClosed;

    AdEventCallback<Ad> onAdImpression;
}
