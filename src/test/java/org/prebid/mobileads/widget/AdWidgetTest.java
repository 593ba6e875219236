package org.prebid.mobileads.widget;

import io.vertx.core.Future;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.prebid.mobileads.ad.BannerAd;
import org.prebid.mobileads.exception.AdWidgetException;
import org.prebid.mobileads.listener.BannerAdListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdRequest;
import org.prebid.mobileads.model.AdSize;
import org.prebid.mobileads.model.Platform;
import org.prebid.mobileads.transport.AdChannel;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.willThrow;
import static org.mockito.Mock.Strictness.LENIENT;
import static org.mockito.Mockito.mock;

@ExtendWith(MockitoExtension.class)
public class AdWidgetTest {

    @Mock(strictness = LENIENT)
    private AdChannel channel;

    private AdInstanceManager instanceManager;

    private BannerAd banner;

    @BeforeEach
    public void setUp() {
        given(channel.name()).willReturn("plugins.flutter.io/google_mobile_ads");
        given(channel.invokeMethod(any(), any())).willReturn(Future.succeededFuture());

        instanceManager = new AdInstanceManager(channel, false, 0.0d);
        banner = new BannerAd(instanceManager, "testId", AdSize.BANNER, AdRequest.empty(),
                BannerAdListener.builder().build());
    }

    @Test
    public void mountShouldReturnPlatformViewHandleOfLoadedAd() {
        // given
        banner.load();
        final AdWidget adWidget = new AdWidget(instanceManager, banner);

        // when
        final PlatformViewHandle handle = adWidget.mount(Platform.IOS);

        // then
        assertThat(handle).isEqualTo(
                PlatformViewHandle.of("plugins.flutter.io/google_mobile_ads/ad_widget", 0, Platform.IOS));
        assertThat(adWidget.isMounted()).isTrue();
        assertThat(instanceManager.isWidgetAdIdMounted(0)).isTrue();
    }

    @Test
    public void mountShouldFailWhenAdIsNotLoaded() {
        // given
        final AdWidget adWidget = new AdWidget(instanceManager, banner);

        // when and then
        assertThatThrownBy(() -> adWidget.mount(Platform.ANDROID))
                .isInstanceOfSatisfying(AdWidgetException.class, exception -> {
                    assertThat(exception.getSummary()).isEqualTo(
                            "AdWidget requires Ad.load to be called before AdWidget is inserted into the tree");
                    assertThat(exception.getHints()).containsExactly(
                            "Parameter ad is not loaded. Call Ad.load before AdWidget is inserted into the tree.");
                });
        assertThat(adWidget.isMounted()).isFalse();
    }

    @Test
    public void mountShouldFailWhenAdIsDisplayedByAnotherWidget() {
        // given
        banner.load();
        new AdWidget(instanceManager, banner).mount(Platform.ANDROID);
        final AdWidget adWidget = new AdWidget(instanceManager, banner);

        // when and then
        assertThatThrownBy(() -> adWidget.mount(Platform.ANDROID))
                .isInstanceOfSatisfying(AdWidgetException.class, exception -> {
                    assertThat(exception.getSummary()).isEqualTo("This AdWidget is already in the Widget tree");
                    assertThat(exception.getHints()).hasSize(2);
                    assertThat(exception.getMessage()).startsWith("This AdWidget is already in the Widget tree\n");
                });
        assertThat(adWidget.isMounted()).isFalse();
    }

    @Test
    public void mountShouldFailWhenWidgetIsAlreadyMounted() {
        // given
        banner.load();
        final AdWidget adWidget = new AdWidget(instanceManager, banner);
        adWidget.mount(Platform.ANDROID);

        // when and then
        assertThatThrownBy(() -> adWidget.mount(Platform.ANDROID)).isInstanceOf(AdWidgetException.class);
        assertThat(adWidget.isMounted()).isTrue();
    }

    @Test
    public void mountShouldFailWithWidgetErrorWhenAnotherWidgetMountsAdFirst() {
        // given
        final AdInstanceManager racingManager = mock(AdInstanceManager.class);
        given(racingManager.adIdFor(banner)).willReturn(0);
        given(racingManager.adFor(0)).willReturn(banner);
        willThrow(new IllegalStateException("Cannot mount ad id 0: already mounted by another widget"))
                .given(racingManager).mountWidgetAdId(0);
        final AdWidget adWidget = new AdWidget(racingManager, banner);

        // when and then
        assertThatThrownBy(() -> adWidget.mount(Platform.ANDROID))
                .isInstanceOfSatisfying(AdWidgetException.class, exception ->
                        assertThat(exception.getSummary()).isEqualTo("This AdWidget is already in the Widget tree"));
        assertThat(adWidget.isMounted()).isFalse();
    }

    @Test
    public void mountShouldFailWithWidgetErrorWhenAdIsDisposedBeforeMount() {
        // given
        final AdInstanceManager racingManager = mock(AdInstanceManager.class);
        given(racingManager.adIdFor(banner)).willReturn(0);
        willThrow(new IllegalStateException("Cannot mount ad id 0: no ad is loaded with this id"))
                .given(racingManager).mountWidgetAdId(0);
        final AdWidget adWidget = new AdWidget(racingManager, banner);

        // when and then
        assertThatThrownBy(() -> adWidget.mount(Platform.ANDROID))
                .isInstanceOfSatisfying(AdWidgetException.class, exception ->
                        assertThat(exception.getSummary()).isEqualTo(
                                "AdWidget requires Ad.load to be called before AdWidget is inserted into the tree"));
        assertThat(adWidget.isMounted()).isFalse();
    }

    @Test
    public void mountShouldSucceedForNewWidgetAfterUnmount() {
        // given
        banner.load();
        final AdWidget first = new AdWidget(instanceManager, banner);
        first.mount(Platform.ANDROID);
        first.unmount();

        // when
        final PlatformViewHandle handle = new AdWidget(instanceManager, banner).mount(Platform.ANDROID);

        // then
        assertThat(handle.getAdId()).isEqualTo(0);
        assertThat(first.isMounted()).isFalse();
    }

    @Test
    public void unmountShouldBeIdempotent() {
        // given
        banner.load();
        final AdWidget adWidget = new AdWidget(instanceManager, banner);
        adWidget.mount(Platform.ANDROID);

        // when
        adWidget.unmount();
        adWidget.unmount();

        // then
        assertThat(adWidget.isMounted()).isFalse();
        assertThat(instanceManager.isWidgetAdIdMounted(0)).isFalse();
    }

    @Test
    public void unmountShouldDoNothingForWidgetThatWasNeverMounted() {
        // given
        banner.load();
        new AdWidget(instanceManager, banner).mount(Platform.ANDROID);

        // when
        new AdWidget(instanceManager, banner).unmount();

        // then
        assertThat(instanceManager.isWidgetAdIdMounted(0)).isTrue();
    }
}
