package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.BannerAdListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.AdSize;
import org.prebid.mobileads.model.Platform;

import java.util.Objects;

/**
 * A banner ad, displayed by an {@link org.prebid.mobileads.widget.AdWidget} once loaded.
 */
public class BannerAd extends AdWithView {

    private static final String ANDROID_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/6300978111";
    private static final String IOS_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/2934735716";

    private final AdSize size;
    private final AdRequest request;
    private final BannerAdListener listener;

    public BannerAd(AdInstanceManager instanceManager,
                    String adUnitId,
                    AdSize size,
                    AdRequest request,
                    BannerAdListener listener) {

        super(instanceManager, adUnitId);
        this.size = Objects.requireNonNull(size);
        this.request = Objects.requireNonNull(request);
        this.listener = Objects.requireNonNull(listener);
    }

    /**
     * Returns the ad unit configured to always serve test ads on the given platform.
     */
    public static String testAdUnitId(Platform platform) {
        return platform == Platform.ANDROID ? ANDROID_TEST_AD_UNIT_ID : IOS_TEST_AD_UNIT_ID;
    }

    public AdSize getSize() {
        return size;
    }

    public AdRequest getRequest() {
        return request;
    }

    @Override
    public BannerAdListener getListener() {
        return listener;
    }

    @Override
    public Future<Void> load() {
        return getInstanceManager().loadBannerAd(this);
    }
}
