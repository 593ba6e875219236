package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.Ad;

/**
 * Lifecycle callbacks shared by all ads displayed inline as a view.
 * <p>
 * Every callback is optional and may be null.
 */
public interface AdWithViewListener {

    AdEventCallback<Ad> getOnAdLoaded();

    AdLoadErrorCallback<Ad> getOnAdFailedToLoad();

    /**
     * Called when the ad opens an overlay that covers the screen.
     */
    AdEventCallback<Ad> getOnAdOpened();

    /**
     * Called before dismissing a full screen view. iOS only.
     */
    AdEventCallback<Ad> getOnAdWillDismissScreen();

    /**
     * Called when the overlay opened by the ad is closed.
     */
    AdEventCallback<Ad> getOnAdClosed();

    AdEventCallback<Ad> getOnAdImpression();
}
