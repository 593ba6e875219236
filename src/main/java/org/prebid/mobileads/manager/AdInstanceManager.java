package org.prebid.mobileads.manager;

import io.vertx.core.Future;
import org.apache.commons.collections4.BidiMap;
import org.apache.commons.collections4.MapUtils;
import org.apache.commons.collections4.bidimap.DualHashBidiMap;
import org.prebid.mobileads.ad.Ad;
import org.prebid.mobileads.ad.AdManagerBannerAd;
import org.prebid.mobileads.ad.AdManagerInterstitialAd;
import org.prebid.mobileads.ad.AdWithView;
import org.prebid.mobileads.ad.AdWithoutView;
import org.prebid.mobileads.ad.BannerAd;
import org.prebid.mobileads.ad.InterstitialAd;
import org.prebid.mobileads.ad.NativeAd;
import org.prebid.mobileads.ad.RewardedAd;
import org.prebid.mobileads.codec.MethodCall;
import org.prebid.mobileads.exception.AdProtocolException;
import org.prebid.mobileads.listener.AdEventCallback;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.listener.AdLoadErrorCallback;
import org.prebid.mobileads.listener.AdWithViewListener;
import org.prebid.mobileads.listener.AppEventCallback;
import org.prebid.mobileads.listener.AppEventListener;
import org.prebid.mobileads.listener.FullScreenContentCallback;
import org.prebid.mobileads.listener.OnUserEarnedRewardCallback;
import org.prebid.mobileads.log.ConditionalLogger;
import org.prebid.mobileads.log.Logger;
import org.prebid.mobileads.log.LoggerFactory;
import org.prebid.mobileads.model.AdError;
import org.prebid.mobileads.model.LoadAdError;
import org.prebid.mobileads.model.RequestConfiguration;
import org.prebid.mobileads.model.RewardItem;
import org.prebid.mobileads.transport.AdChannel;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Keeps track of the ads living on the native side and routes native events to them.
 * <p>
 * Every ad that starts loading gets an id, unique for the lifetime of this manager, which is the join key of
 * all calls and events crossing the {@link AdChannel}. The manager also tracks which ids are displayed by a
 * widget and which ones have been reported as loaded.
 * <p>
 * State changes are serialized on this instance, callbacks are invoked outside of the lock on the thread
 * delivering the native event.
 */
public class AdInstanceManager {

    private static final Logger logger = LoggerFactory.getLogger(AdInstanceManager.class);
    private static final ConditionalLogger conditionalLogger = new ConditionalLogger(logger);

    static final String UPDATE_REQUEST_CONFIGURATION_METHOD = "MobileAds#updateRequestConfiguration";
    static final String SET_SAME_APP_KEY_ENABLED_METHOD = "MobileAds#setSameAppKeyEnabled";
    static final String LOAD_BANNER_AD_METHOD = "loadBannerAd";
    static final String LOAD_AD_MANAGER_BANNER_AD_METHOD = "loadAdManagerBannerAd";
    static final String LOAD_NATIVE_AD_METHOD = "loadNativeAd";
    static final String LOAD_INTERSTITIAL_AD_METHOD = "loadInterstitialAd";
    static final String LOAD_AD_MANAGER_INTERSTITIAL_AD_METHOD = "loadAdManagerInterstitialAd";
    static final String LOAD_REWARDED_AD_METHOD = "loadRewardedAd";
    static final String SHOW_AD_WITHOUT_VIEW_METHOD = "showAdWithoutView";
    static final String DISPOSE_AD_METHOD = "disposeAd";
    static final String ON_AD_EVENT_METHOD = "onAdEvent";

    private final AdChannel channel;
    private final boolean disposeOnLoadFailure;
    private final double logSamplingRate;

    private final BidiMap<Integer, Ad> loadedAds = new DualHashBidiMap<>();
    private final Set<Integer> mountedWidgetAdIds = new HashSet<>();
    private final Set<Integer> onAdLoadedAdIds = new HashSet<>();
    private int nextAdId;

    /**
     * Creates the manager and subscribes it to the native events of the given channel.
     *
     * @param disposeOnLoadFailure whether an ad failing to load is disposed right after its failure callback,
     *                             otherwise the application is expected to dispose it
     */
    public AdInstanceManager(AdChannel channel, boolean disposeOnLoadFailure, double logSamplingRate) {
        this.channel = Objects.requireNonNull(channel);
        this.disposeOnLoadFailure = disposeOnLoadFailure;
        this.logSamplingRate = logSamplingRate;

        channel.setMethodCallHandler(this::handleMethodCall);
    }

    public String channelName() {
        return channel.name();
    }

    /**
     * Binds the ad to the next id. Ids are never handed out again, even after the ad is disposed.
     * <p>
     * An ad keeps a single id: if it already had one, the previous id is retired.
     */
    public synchronized int registerNewAdId(Ad ad) {
        Objects.requireNonNull(ad);

        final Integer previousAdId = loadedAds.removeValue(ad);
        if (previousAdId != null) {
            logger.warn("Ad {} is registered again, retiring its id {}", ad.getAdUnitId(), previousAdId);
            mountedWidgetAdIds.remove(previousAdId);
            onAdLoadedAdIds.remove(previousAdId);
        }

        final int adId = nextAdId++;
        loadedAds.put(adId, ad);
        return adId;
    }

    /**
     * Returns the id of the ad, or null if it was never loaded or has been disposed.
     */
    public synchronized Integer adIdFor(Ad ad) {
        return loadedAds.getKey(ad);
    }

    public synchronized Ad adFor(int adId) {
        return loadedAds.get(adId);
    }

    public synchronized boolean onAdLoadedCalled(Ad ad) {
        final Integer adId = loadedAds.getKey(ad);
        return adId != null && onAdLoadedAdIds.contains(adId);
    }

    synchronized boolean onAdLoadedCalled(int adId) {
        return onAdLoadedAdIds.contains(adId);
    }

    public synchronized boolean isWidgetAdIdMounted(int adId) {
        return mountedWidgetAdIds.contains(adId);
    }

    /**
     * Marks the id as displayed by a widget.
     *
     * @throws IllegalStateException if no ad has the id or it is already mounted
     */
    public synchronized void mountWidgetAdId(int adId) {
        if (!loadedAds.containsKey(adId)) {
            throw new IllegalStateException("Cannot mount ad id " + adId + ": no ad is loaded with this id");
        }
        if (!mountedWidgetAdIds.add(adId)) {
            throw new IllegalStateException("Cannot mount ad id " + adId + ": already mounted by another widget");
        }
    }

    public synchronized void unmountWidgetAdId(int adId) {
        mountedWidgetAdIds.remove(adId);
    }

    public Future<Void> loadBannerAd(BannerAd ad) {
        return load(ad, LOAD_BANNER_AD_METHOD, arguments -> {
            arguments.put("request", ad.getRequest());
            arguments.put("size", ad.getSize());
        });
    }

    public Future<Void> loadAdManagerBannerAd(AdManagerBannerAd ad) {
        return load(ad, LOAD_AD_MANAGER_BANNER_AD_METHOD, arguments -> {
            arguments.put("request", ad.getRequest());
            arguments.put("sizes", ad.getSizes());
        });
    }

    public Future<Void> loadNativeAd(NativeAd ad) {
        return load(ad, LOAD_NATIVE_AD_METHOD, arguments -> {
            arguments.put("request", ad.getRequest());
            arguments.put("adManagerRequest", ad.getAdManagerRequest());
            arguments.put("factoryId", ad.getFactoryId());
            arguments.put("customOptions", ad.getCustomOptions());
        });
    }

    public Future<Void> loadInterstitialAd(InterstitialAd ad) {
        return load(ad, LOAD_INTERSTITIAL_AD_METHOD, arguments -> arguments.put("request", ad.getRequest()));
    }

    public Future<Void> loadAdManagerInterstitialAd(AdManagerInterstitialAd ad) {
        return load(ad, LOAD_AD_MANAGER_INTERSTITIAL_AD_METHOD,
                arguments -> arguments.put("request", ad.getRequest()));
    }

    public Future<Void> loadRewardedAd(RewardedAd ad) {
        return load(ad, LOAD_REWARDED_AD_METHOD, arguments -> {
            arguments.put("request", ad.getRequest());
            arguments.put("adManagerRequest", ad.getAdManagerRequest());
            arguments.put("serverSideVerificationOptions", ad.getServerSideVerificationOptions());
        });
    }

    /**
     * Displays a loaded full screen ad.
     *
     * @throws IllegalStateException if the ad has not been loaded or has been disposed
     */
    public Future<Void> showAdWithoutView(AdWithoutView<?> ad) {
        final Integer adId = adIdFor(ad);
        if (adId == null) {
            throw new IllegalStateException("Ad " + ad.getAdUnitId() + " has to be loaded before it is shown");
        }

        return channel.invokeMethod(SHOW_AD_WITHOUT_VIEW_METHOD, Collections.singletonMap("adId", adId));
    }

    /**
     * Releases the native resources of the ad and forgets its id. Does nothing if the ad has no id.
     */
    public Future<Void> disposeAd(Ad ad) {
        return dispose(ad, null);
    }

    public Future<Void> updateRequestConfiguration(RequestConfiguration requestConfiguration) {
        final Map<String, Object> arguments = new LinkedHashMap<>();
        if (requestConfiguration.getMaxAdContentRating() != null) {
            arguments.put("maxAdContentRating", requestConfiguration.getMaxAdContentRating().value());
        }
        if (requestConfiguration.getTagForChildDirectedTreatment() != null) {
            arguments.put("tagForChildDirectedTreatment",
                    requestConfiguration.getTagForChildDirectedTreatment().value());
        }
        if (requestConfiguration.getTagForUnderAgeOfConsent() != null) {
            arguments.put("tagForUnderAgeOfConsent", requestConfiguration.getTagForUnderAgeOfConsent().value());
        }
        if (requestConfiguration.getTestDeviceIds() != null) {
            arguments.put("testDeviceIds", requestConfiguration.getTestDeviceIds());
        }

        return channel.invokeMethod(UPDATE_REQUEST_CONFIGURATION_METHOD, arguments);
    }

    public Future<Void> setSameAppKeyEnabled(boolean enabled) {
        return channel.invokeMethod(SET_SAME_APP_KEY_ENABLED_METHOD, Collections.singletonMap("isEnabled", enabled));
    }

    /**
     * Unsubscribes from the channel and forgets every ad. Native resources are not released.
     */
    public void close() {
        channel.setMethodCallHandler(null);

        synchronized (this) {
            loadedAds.clear();
            mountedWidgetAdIds.clear();
            onAdLoadedAdIds.clear();
        }

        logger.info("Closed ad instance manager of channel {}", channel.name());
    }

    /**
     * Disposes the ad if it still has an id, and that id is {@code expectedAdId} when one is given.
     */
    private Future<Void> dispose(Ad ad, Integer expectedAdId) {
        final Future<Void> result;
        synchronized (this) {
            final Integer adId = loadedAds.getKey(ad);
            if (adId == null || (expectedAdId != null && !expectedAdId.equals(adId))) {
                return Future.succeededFuture();
            }

            result = channel.invokeMethod(DISPOSE_AD_METHOD, Collections.singletonMap("adId", adId));

            loadedAds.remove(adId);
            mountedWidgetAdIds.remove(adId);
            onAdLoadedAdIds.remove(adId);
        }

        logger.debug("Disposed ad {}", ad.getAdUnitId());
        return result;
    }

    private Future<Void> load(Ad ad, String method, Consumer<Map<String, Object>> argumentsPopulator) {
        final int adId;
        synchronized (this) {
            final Integer existingAdId = loadedAds.getKey(ad);
            if (existingAdId != null) {
                logger.debug("Ad {} is already loading with id {}", ad.getAdUnitId(), existingAdId);
                return Future.succeededFuture();
            }
            adId = registerNewAdId(ad);
        }

        final Map<String, Object> arguments = new LinkedHashMap<>();
        arguments.put("adId", adId);
        arguments.put("adUnitId", ad.getAdUnitId());
        argumentsPopulator.accept(arguments);

        return channel.invokeMethod(method, arguments);
    }

    private void handleMethodCall(MethodCall methodCall) {
        if (!ON_AD_EVENT_METHOD.equals(methodCall.getMethod())) {
            throw new AdProtocolException("Unexpected method call from native side: " + methodCall.getMethod());
        }

        final Map<String, Object> arguments = MapUtils.emptyIfNull(methodCall.getArguments());
        final int adId = requiredArgument(arguments, "adId", Integer.class);
        final AdEventName eventName = AdEventName.fromValue(requiredArgument(arguments, "eventName", String.class));

        final Ad ad;
        synchronized (this) {
            ad = loadedAds.get(adId);
            if (ad != null && eventName == AdEventName.ON_AD_LOADED) {
                onAdLoadedAdIds.add(adId);
            }
        }
        if (ad == null) {
            conditionalLogger.debug(
                    String.format("Dropped %s event of ad %d which is disposed", eventName.value(), adId),
                    logSamplingRate);
            return;
        }

        onAdEvent(adId, ad, eventName, arguments);
    }

    private void onAdEvent(int adId, Ad ad, AdEventName eventName, Map<String, Object> arguments) {
        switch (eventName) {
            case ON_AD_LOADED -> onAdLoaded(ad);
            case ON_AD_FAILED_TO_LOAD -> onAdFailedToLoad(adId, ad,
                    requiredArgument(arguments, "loadAdError", LoadAdError.class));
            case ON_AD_OPENED -> notifyViewListener(ad, AdWithViewListener::getOnAdOpened);
            case ON_AD_CLOSED -> notifyViewListener(ad, AdWithViewListener::getOnAdClosed);
            case ON_AD_WILL_DISMISS_SCREEN -> notifyViewListener(ad, AdWithViewListener::getOnAdWillDismissScreen);
            case ON_AD_IMPRESSION -> onAdImpression(ad);
            case ON_NATIVE_AD_CLICKED -> onNativeAdClicked(ad);
            case ON_APP_EVENT -> onAppEvent(ad,
                    requiredArgument(arguments, "name", String.class),
                    requiredArgument(arguments, "data", String.class));
            case ON_AD_SHOWED_FULL_SCREEN_CONTENT,
                    ON_AD_FAILED_TO_SHOW_FULL_SCREEN_CONTENT,
                    ON_AD_WILL_DISMISS_FULL_SCREEN_CONTENT,
                    ON_AD_DISMISSED_FULL_SCREEN_CONTENT -> onFullScreenContentEvent(ad, eventName, arguments);
            case ON_REWARDED_AD_USER_EARNED_REWARD -> onUserEarnedReward(ad,
                    requiredArgument(arguments, "rewardItem", RewardItem.class));
            default -> throw new AdProtocolException("Unsupported ad event: " + eventName.value());
        }
    }

    private void onAdLoaded(Ad ad) {
        if (ad instanceof AdWithView adWithView) {
            invokeCallback(adWithView.getListener().getOnAdLoaded(), ad);
        } else if (ad instanceof AdWithoutView<?> adWithoutView) {
            notifyLoaded(adWithoutView);
        }
    }

    private void onAdFailedToLoad(int adId, Ad ad, LoadAdError error) {
        if (ad instanceof AdWithView adWithView) {
            final AdLoadErrorCallback<Ad> callback = adWithView.getListener().getOnAdFailedToLoad();
            if (callback != null) {
                callback.onAdFailedToLoad(ad, error);
            }
        } else if (ad instanceof AdWithoutView<?> adWithoutView) {
            notifyFailedToLoad(adWithoutView, error);
        }

        if (disposeOnLoadFailure) {
            dispose(ad, adId);
        }
    }

    private void onAdImpression(Ad ad) {
        if (ad instanceof AdWithView) {
            notifyViewListener(ad, AdWithViewListener::getOnAdImpression);
        } else if (ad instanceof AdWithoutView<?> adWithoutView) {
            notifyFullScreenContentCallback(adWithoutView, AdEventName.ON_AD_IMPRESSION, null);
        }
    }

    private void onNativeAdClicked(Ad ad) {
        if (ad instanceof NativeAd nativeAd) {
            invokeCallback(nativeAd.getListener().getOnNativeAdClicked(), nativeAd);
        }
    }

    private void onAppEvent(Ad ad, String name, String data) {
        final AppEventListener appEventListener;
        if (ad instanceof AdManagerBannerAd adManagerBannerAd) {
            appEventListener = adManagerBannerAd.getListener();
        } else if (ad instanceof AdManagerInterstitialAd adManagerInterstitialAd) {
            appEventListener = adManagerInterstitialAd.getAppEventListener();
        } else {
            appEventListener = null;
        }

        final AppEventCallback callback = appEventListener != null ? appEventListener.getOnAppEvent() : null;
        if (callback != null) {
            callback.onAppEvent(ad, name, data);
        }
    }

    private void onFullScreenContentEvent(Ad ad, AdEventName eventName, Map<String, Object> arguments) {
        if (ad instanceof AdWithoutView<?> adWithoutView) {
            final AdError error = eventName == AdEventName.ON_AD_FAILED_TO_SHOW_FULL_SCREEN_CONTENT
                    ? requiredArgument(arguments, "error", AdError.class)
                    : null;
            notifyFullScreenContentCallback(adWithoutView, eventName, error);
        }
    }

    private void onUserEarnedReward(Ad ad, RewardItem rewardItem) {
        if (ad instanceof RewardedAd rewardedAd) {
            final OnUserEarnedRewardCallback callback = rewardedAd.getOnUserEarnedRewardCallback();
            if (callback != null) {
                callback.onUserEarnedReward(rewardedAd, rewardItem);
            }
        }
    }

    private static void notifyViewListener(Ad ad,
                                           Function<AdWithViewListener, AdEventCallback<Ad>> callbackSelector) {

        if (ad instanceof AdWithView adWithView) {
            invokeCallback(callbackSelector.apply(adWithView.getListener()), ad);
        }
    }

    /**
     * Full screen ads are declared as {@code AdWithoutView<Self>}, so the ad is always an {@code A}.
     */
    @SuppressWarnings("unchecked")
    private static <A extends AdWithoutView<A>> void notifyLoaded(AdWithoutView<A> ad) {
        invokeCallback(ad.getAdLoadCallback().getOnAdLoaded(), (A) ad);
    }

    @SuppressWarnings("unchecked")
    private static <A extends AdWithoutView<A>> void notifyFailedToLoad(AdWithoutView<A> ad, LoadAdError error) {
        final AdLoadCallback<A> callback = ad.getAdLoadCallback();
        callback.getOnAdFailedToLoad().onAdFailedToLoad((A) ad, error);
    }

    @SuppressWarnings("unchecked")
    private static <A extends AdWithoutView<A>> void notifyFullScreenContentCallback(AdWithoutView<A> ad,
                                                                                   AdEventName eventName,
                                                                                   AdError error) {

        final FullScreenContentCallback<A> callback = ad.getFullScreenContentCallback();
        if (callback == null) {
            return;
        }

        final A self = (A) ad;
        switch (eventName) {
            case ON_AD_SHOWED_FULL_SCREEN_CONTENT -> invokeCallback(callback.getOnAdShowedFullScreenContent(), self);
            case ON_AD_IMPRESSION -> invokeCallback(callback.getOnAdImpression(), self);
            case ON_AD_WILL_DISMISS_FULL_SCREEN_CONTENT ->
                    invokeCallback(callback.getOnAdWillDismissFullScreenContent(), self);
            case ON_AD_DISMISSED_FULL_SCREEN_CONTENT ->
                    invokeCallback(callback.getOnAdDismissedFullScreenContent(), self);
            case ON_AD_FAILED_TO_SHOW_FULL_SCREEN_CONTENT -> {
                if (callback.getOnAdFailedToShowFullScreenContent() != null) {
                    callback.getOnAdFailedToShowFullScreenContent().onAdError(self, error);
                }
            }
            default -> throw new IllegalArgumentException("Not a full screen content event: " + eventName);
        }
    }

    private static <A extends Ad> void invokeCallback(AdEventCallback<A> callback, A ad) {
        if (callback != null) {
            callback.onAdEvent(ad);
        }
    }

    private static <T> T requiredArgument(Map<String, Object> arguments, String name, Class<T> type) {
        final Object value = arguments.get(name);
        if (!type.isInstance(value)) {
            throw new AdProtocolException(String.format("Ad event argument %s is expected to be %s but was %s",
                    name, type.getSimpleName(), value != null ? value.getClass().getSimpleName() : "absent"));
        }
        return type.cast(value);
    }
}
