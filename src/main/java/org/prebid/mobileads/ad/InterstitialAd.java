package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.Platform;

import java.util.Objects;

/**
 * A full screen interstitial ad.
 */
public final class InterstitialAd extends AdWithoutView<InterstitialAd> {

    private static final String ANDROID_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/1033173712";
    private static final String IOS_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/4411468910";

    private final AdRequest request;

    private InterstitialAd(AdInstanceManager instanceManager,
                           String adUnitId,
                           AdRequest request,
                           AdLoadCallback<InterstitialAd> adLoadCallback) {

        super(instanceManager, adUnitId, adLoadCallback);
        this.request = Objects.requireNonNull(request);
    }

    /**
     * Loads an interstitial ad. The ad is handed to {@code adLoadCallback} once loaded.
     */
    public static Future<Void> load(AdInstanceManager instanceManager,
                                    String adUnitId,
                                    AdRequest request,
                                    AdLoadCallback<InterstitialAd> adLoadCallback) {

        return instanceManager.loadInterstitialAd(
                new InterstitialAd(instanceManager, adUnitId, request, adLoadCallback));
    }

    public static String testAdUnitId(Platform platform) {
        return platform == Platform.ANDROID ? ANDROID_TEST_AD_UNIT_ID : IOS_TEST_AD_UNIT_ID;
    }

    public AdRequest getRequest() {
        return request;
    }
}
