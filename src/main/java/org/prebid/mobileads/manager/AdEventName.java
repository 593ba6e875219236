package org.prebid.mobileads.manager;

import org.prebid.mobileads.exception.AdProtocolException;

import java.util.Arrays;

/**
 * Closed set of ad events the native side may send with an {@code onAdEvent} call.
 */
public enum AdEventName {

    ON_AD_LOADED("onAdLoaded"),
    ON_AD_FAILED_TO_LOAD("onAdFailedToLoad"),
    ON_AD_OPENED("onAdOpened"),
    ON_AD_CLOSED("onAdClosed"),
    ON_AD_IMPRESSION("onAdImpression"),
    ON_AD_WILL_DISMISS_SCREEN("onAdWillDismissScreen"),
    ON_NATIVE_AD_CLICKED("onNativeAdClicked"),
    ON_APP_EVENT("onAppEvent"),
    ON_AD_SHOWED_FULL_SCREEN_CONTENT("onAdShowedFullScreenContent"),
    ON_AD_FAILED_TO_SHOW_FULL_SCREEN_CONTENT("onAdFailedToShowFullScreenContent"),
    ON_AD_WILL_DISMISS_FULL_SCREEN_CONTENT("onAdWillDismissFullScreenContent"),
    ON_AD_DISMISSED_FULL_SCREEN_CONTENT("onAdDismissedFullScreenContent"),
    ON_REWARDED_AD_USER_EARNED_REWARD("onRewardedAdUserEarnedReward");

    private final String value;

    AdEventName(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    /**
     * @throws AdProtocolException if the name is not a known event
     */
    public static AdEventName fromValue(String value) {
        return Arrays.stream(values())
                .filter(eventName -> eventName.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new AdProtocolException("Unknown ad event: " + value));
    }
}
