package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.listener.AdManagerBannerAdListener;
import org.prebid.mobileads.listener.NativeAdListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdManagerAdRequest;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.Platform;
import org.prebid.mobileads.transport.AdChannel;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatIllegalArgumentException;
import static org.assertj.core.api.Assertions.assertThatNullPointerException;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mock.Strictness.LENIENT;

@ExtendWith(MockitoExtension.class)
public class AdTest {

    @Mock(strictness = LENIENT)
    private AdChannel channel;

    private AdInstanceManager instanceManager;

    @BeforeEach
    public void setUp() {
        given(channel.invokeMethod(any(), any())).willReturn(Future.succeededFuture());

        instanceManager = new AdInstanceManager(channel, false, 0.0d);
    }

    @Test
    public void adManagerBannerAdShouldRequireAtLeastOneSize() {
        assertThatIllegalArgumentException()
                .isThrownBy(() -> new AdManagerBannerAd(instanceManager, "testId", Collections.emptyList(),
                        AdManagerAdRequest.empty(), AdManagerBannerAdListener.builder().build()))
                .withMessage("At least one ad size is required");
    }

    @Test
    public void nativeAdCreateShouldSetOnlyAdMobRequest() {
        // when
        final NativeAd nativeAd = NativeAd.create(instanceManager, "testId", "factory", AdRequest.empty(),
                NativeAdListener.builder().build(), null);

        // then
        assertThat(nativeAd.getRequest()).isEqualTo(AdRequest.empty());
        assertThat(nativeAd.getAdManagerRequest()).isNull();
        assertThat(nativeAd.getFactoryId()).isEqualTo("factory");
    }

    @Test
    public void nativeAdFromAdManagerRequestShouldSetOnlyAdManagerRequest() {
        // when
        final NativeAd nativeAd = NativeAd.fromAdManagerRequest(instanceManager, "testId", "factory",
                AdManagerAdRequest.empty(), NativeAdListener.builder().build(), null);

        // then
        assertThat(nativeAd.getRequest()).isNull();
        assertThat(nativeAd.getAdManagerRequest()).isEqualTo(AdManagerAdRequest.empty());
    }

    @Test
    public void nativeAdShouldRequireFactoryId() {
        assertThatNullPointerException().isThrownBy(() -> NativeAd.create(instanceManager, "testId", null,
                AdRequest.empty(), NativeAdListener.builder().build(), null));
    }

    @Test
    public void rewardedAdShouldRequireRewardCallbackToShow() {
        // given
        RewardedAd.load(instanceManager, "testId", AdRequest.empty(),
                AdLoadCallback.of(ad -> { }, (ad, error) -> { }), null);
        final RewardedAd rewardedAd = (RewardedAd) instanceManager.adFor(0);

        // when and then
        assertThatNullPointerException().isThrownBy(() -> rewardedAd.show(null));
    }

    @Test
    public void rewardedAdLoadedWithAdManagerRequestShouldNotCarryAdMobRequest() {
        // when
        RewardedAd.loadWithAdManagerAdRequest(instanceManager, "testId", AdManagerAdRequest.empty(),
                AdLoadCallback.of(ad -> { }, (ad, error) -> { }), null);

        // then
        final RewardedAd rewardedAd = (RewardedAd) instanceManager.adFor(0);
        assertThat(rewardedAd.getRequest()).isNull();
        assertThat(rewardedAd.getAdManagerRequest()).isEqualTo(AdManagerAdRequest.empty());
    }

    @Test
    public void adLoadCallbackShouldRequireBothCallbacks() {
        assertThatNullPointerException().isThrownBy(() -> AdLoadCallback.<InterstitialAd>of(null, (ad, error) -> { }));
    }

    @Test
    public void testAdUnitIdShouldDependOnPlatform() {
        assertThat(BannerAd.testAdUnitId(Platform.ANDROID)).isEqualTo("ca-app-pub-3940256099942544/6300978111");
        assertThat(BannerAd.testAdUnitId(Platform.IOS)).isEqualTo("ca-app-pub-3940256099942544/2934735716");
        assertThat(NativeAd.testAdUnitId(Platform.ANDROID)).isEqualTo("ca-app-pub-3940256099942544/2247696110");
        assertThat(NativeAd.testAdUnitId(Platform.IOS)).isEqualTo("ca-app-pub-3940256099942544/3986624511");
        assertThat(InterstitialAd.testAdUnitId(Platform.ANDROID))
                .isEqualTo("ca-app-pub-3940256099942544/1033173712");
        assertThat(InterstitialAd.testAdUnitId(Platform.IOS)).isEqualTo("ca-app-pub-3940256099942544/4411468910");
        assertThat(RewardedAd.testAdUnitId(Platform.ANDROID)).isEqualTo("ca-app-pub-3940256099942544/5224354917");
        assertThat(RewardedAd.testAdUnitId(Platform.IOS)).isEqualTo("ca-app-pub-3940256099942544/1712485313");
    }
}
