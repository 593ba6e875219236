package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.listener.OnUserEarnedRewardCallback;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdManagerAdRequest;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.Platform;
import org.prebid.mobileads.model.ServerSideVerificationOptions;

import java.util.Objects;

/**
 * A full screen ad users may interact with in exchange for in-app rewards.
 * <p>
 * Exactly one of {@link #getRequest()} and {@link #getAdManagerRequest()} is set.
 */
public final class RewardedAd extends AdWithoutView<RewardedAd> {

    private static final String ANDROID_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/5224354917";
    private static final String IOS_TEST_AD_UNIT_ID = "ca-app-pub-3940256099942544/1712485313";

    private final AdRequest request;
    private final AdManagerAdRequest adManagerRequest;
    private final ServerSideVerificationOptions serverSideVerificationOptions;

    private volatile OnUserEarnedRewardCallback onUserEarnedRewardCallback;

    private RewardedAd(AdInstanceManager instanceManager,
                       String adUnitId,
                       AdRequest request,
                       AdManagerAdRequest adManagerRequest,
                       AdLoadCallback<RewardedAd> adLoadCallback,
                       ServerSideVerificationOptions serverSideVerificationOptions) {

        super(instanceManager, adUnitId, adLoadCallback);
        this.request = request;
        this.adManagerRequest = adManagerRequest;
        this.serverSideVerificationOptions = serverSideVerificationOptions;
    }

    /**
     * Loads a rewarded ad with an AdMob request.
     *
     * @param serverSideVerificationOptions options of server-to-server reward callbacks, can be null
     */
    public static Future<Void> load(AdInstanceManager instanceManager,
                                    String adUnitId,
                                    AdRequest request,
                                    AdLoadCallback<RewardedAd> adLoadCallback,
                                    ServerSideVerificationOptions serverSideVerificationOptions) {

        return instanceManager.loadRewardedAd(new RewardedAd(instanceManager, adUnitId,
                Objects.requireNonNull(request), null, adLoadCallback, serverSideVerificationOptions));
    }

    /**
     * Loads a rewarded ad with an Ad Manager request.
     */
    public static Future<Void> loadWithAdManagerAdRequest(
            AdInstanceManager instanceManager,
            String adUnitId,
            AdManagerAdRequest adManagerRequest,
            AdLoadCallback<RewardedAd> adLoadCallback,
            ServerSideVerificationOptions serverSideVerificationOptions) {

        return instanceManager.loadRewardedAd(new RewardedAd(instanceManager, adUnitId,
                null, Objects.requireNonNull(adManagerRequest), adLoadCallback, serverSideVerificationOptions));
    }

    public static String testAdUnitId(Platform platform) {
        return platform == Platform.ANDROID ? ANDROID_TEST_AD_UNIT_ID : IOS_TEST_AD_UNIT_ID;
    }

    public AdRequest getRequest() {
        return request;
    }

    public AdManagerAdRequest getAdManagerRequest() {
        return adManagerRequest;
    }

    public ServerSideVerificationOptions getServerSideVerificationOptions() {
        return serverSideVerificationOptions;
    }

    public OnUserEarnedRewardCallback getOnUserEarnedRewardCallback() {
        return onUserEarnedRewardCallback;
    }

    /**
     * Displays this ad on top of the application; {@code onUserEarnedReward} is notified when the user earns
     * the reward.
     */
    public Future<Void> show(OnUserEarnedRewardCallback onUserEarnedReward) {
        onUserEarnedRewardCallback = Objects.requireNonNull(onUserEarnedReward);
        return show();
    }
}
