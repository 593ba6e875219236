package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.listener.AppEventListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdManagerAdRequest;

import java.util.Objects;

/**
 * A full screen interstitial ad served by Ad Manager.
 */
public final class AdManagerInterstitialAd extends AdWithoutView<AdManagerInterstitialAd> {

    private final AdManagerAdRequest request;

    private volatile AppEventListener appEventListener;

    private AdManagerInterstitialAd(AdInstanceManager instanceManager,
                                    String adUnitId,
                                    AdManagerAdRequest request,
                                    AdLoadCallback<AdManagerInterstitialAd> adLoadCallback,
                                    AppEventListener appEventListener) {

        super(instanceManager, adUnitId, adLoadCallback);
        this.request = Objects.requireNonNull(request);
        this.appEventListener = appEventListener;
    }

    /**
     * Loads an Ad Manager interstitial ad. The ad is handed to {@code adLoadCallback} once loaded.
     *
     * @param appEventListener receives app events of the ad, can be null
     */
    public static Future<Void> load(AdInstanceManager instanceManager,
                                    String adUnitId,
                                    AdManagerAdRequest request,
                                    AdLoadCallback<AdManagerInterstitialAd> adLoadCallback,
                                    AppEventListener appEventListener) {

        return instanceManager.loadAdManagerInterstitialAd(new AdManagerInterstitialAd(
                instanceManager, adUnitId, request, adLoadCallback, appEventListener));
    }

    public AdManagerAdRequest getRequest() {
        return request;
    }

    public AppEventListener getAppEventListener() {
        return appEventListener;
    }

    public void setAppEventListener(AppEventListener appEventListener) {
        this.appEventListener = appEventListener;
    }
}
