package org.prebid.mobileads.widget;

import org.prebid.mobileads.ad.AdWithView;
import org.prebid.mobileads.exception.AdWidgetException;
import org.prebid.mobileads.log.Logger;
import org.prebid.mobileads.log.LoggerFactory;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.Platform;

import java.util.Arrays;
import java.util.Collections;
import java.util.Objects;

/**
 * Displays a loaded {@link AdWithView} in the host UI tree.
 * <p>
 * An ad can be displayed by a single widget at a time. The widget has to be mounted when it enters the tree and
 * unmounted when it leaves it; mounting fails if the ad is not loaded or is already displayed.
 */
public class AdWidget {

    private static final Logger logger = LoggerFactory.getLogger(AdWidget.class);

    private static final String VIEW_TYPE_SUFFIX = "/ad_widget";

    private final AdInstanceManager instanceManager;
    private final AdWithView ad;

    private Integer mountedAdId;

    public AdWidget(AdInstanceManager instanceManager, AdWithView ad) {
        this.instanceManager = Objects.requireNonNull(instanceManager);
        this.ad = Objects.requireNonNull(ad);
    }

    public AdWithView getAd() {
        return ad;
    }

    /**
     * Attaches the ad to this widget and returns the handle of its native view.
     *
     * @throws AdWidgetException if the ad has not been loaded or is already displayed, by this or another widget
     */
    public synchronized PlatformViewHandle mount(Platform platform) {
        Objects.requireNonNull(platform);

        final Integer adId = instanceManager.adIdFor(ad);
        if (adId == null) {
            throw notLoadedException();
        }
        if (mountedAdId != null || instanceManager.isWidgetAdIdMounted(adId)) {
            throw alreadyMountedException();
        }

        try {
            instanceManager.mountWidgetAdId(adId);
        } catch (IllegalStateException e) {
            // another widget or a dispose got between the checks above and the mount
            throw instanceManager.adFor(adId) == null ? notLoadedException() : alreadyMountedException();
        }
        mountedAdId = adId;

        logger.debug("Mounted ad {} with id {}", ad.getAdUnitId(), adId);
        return PlatformViewHandle.of(instanceManager.channelName() + VIEW_TYPE_SUFFIX, adId, platform);
    }

    /**
     * Detaches the ad from this widget. Does nothing if the widget is not mounted.
     */
    public synchronized void unmount() {
        if (mountedAdId != null) {
            instanceManager.unmountWidgetAdId(mountedAdId);
            mountedAdId = null;
        }
    }

    public synchronized boolean isMounted() {
        return mountedAdId != null;
    }

    private static AdWidgetException notLoadedException() {
        return new AdWidgetException(
                "AdWidget requires Ad.load to be called before AdWidget is inserted into the tree",
                Collections.singletonList(
                        "Parameter ad is not loaded. Call Ad.load before AdWidget is inserted into the tree."));
    }

    private static AdWidgetException alreadyMountedException() {
        return new AdWidgetException(
                "This AdWidget is already in the Widget tree",
                Arrays.asList(
                        "If you placed this AdWidget in a list, make sure you create a new instance "
                                + "in the builder function with a unique ad object.",
                        "Make sure you are not using the same ad object in more than one AdWidget."));
    }
}
