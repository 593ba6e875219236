package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.NativeAdListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdManagerAdRequest;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.Platform;

import java.util.Map;
import java.util.Objects;

/**
 * A native ad, rendered on the native side by the factory registered under {@code factoryId}.
 * <p>
 * Exactly one of {@link #getRequest()} and {@link #getAdManagerRequest()} is set.
 */
public class NativeAd extends AdWithView {

    private static final String ANDROID_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/2247696110";
    private static final String IOS_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/3986624511";

    private final String factoryId;
    private final NativeAdListener listener;
    private final AdRequest request;
    private final AdManagerAdRequest adManagerRequest;
    private final Map<String, Object> customOptions;

    private NativeAd(AdInstanceManager instanceManager,
                     String adUnitId,
                     String factoryId,
                     NativeAdListener listener,
                     AdRequest request,
                     AdManagerAdRequest adManagerRequest,
                     Map<String, Object> customOptions) {

        super(instanceManager, adUnitId);
        this.factoryId = Objects.requireNonNull(factoryId);
        this.listener = Objects.requireNonNull(listener);
        this.request = request;
        this.adManagerRequest = adManagerRequest;
        this.customOptions = customOptions;
    }

    public static NativeAd create(AdInstanceManager instanceManager,
                                  String adUnitId,
                                  String factoryId,
                                  AdRequest request,
                                  NativeAdListener listener,
                                  Map<String, Object> customOptions) {

        return new NativeAd(instanceManager, adUnitId, factoryId, listener,
                Objects.requireNonNull(request), null, customOptions);
    }

    public static NativeAd fromAdManagerRequest(AdInstanceManager instanceManager,
                                                String adUnitId,
                                                String factoryId,
                                                AdManagerAdRequest adManagerRequest,
                                                NativeAdListener listener,
                                                Map<String, Object> customOptions) {

        return new NativeAd(instanceManager, adUnitId, factoryId, listener,
                null, Objects.requireNonNull(adManagerRequest), customOptions);
    }

    public static String testAdUnitId(Platform platform) {
        return platform == Platform.ANDROID ? ANDROID_TEST_AD_UNIT_ID : IOS_TEST_AD_UNIT_ID;
    }

    public String getFactoryId() {
        return factoryId;
    }

    public AdRequest getRequest() {
        return request;
    }

    public AdManagerAdRequest getAdManagerRequest() {
        return adManagerRequest;
    }

    /**
     * Options passed as is to the native ad factory. Can be null.
     */
    public Map<String, Object> getCustomOptions() {
        return customOptions;
    }

    @Override
    public NativeAdListener getListener() {
        return listener;
    }

    @Override
    public Future<Void> load() {
        return getInstanceManager().loadNativeAd(this);
    }
}
