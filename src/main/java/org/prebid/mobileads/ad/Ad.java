package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.manager.AdInstanceManager;

import java.util.Objects;

/**
 * Base class of all ads.
 * <p>
 * Ads compare by identity: two ads with the same configuration are still two native ad instances.
 */
public abstract class Ad {

    private final AdInstanceManager instanceManager;
    private final String adUnitId;

    protected Ad(AdInstanceManager instanceManager, String adUnitId) {
        this.instanceManager = Objects.requireNonNull(instanceManager);
        this.adUnitId = Objects.requireNonNull(adUnitId);
    }

    /**
     * Identifies the source of ads, as configured in the ad network dashboard.
     */
    public String getAdUnitId() {
        return adUnitId;
    }

    /**
     * Frees the native resources associated with this ad. Safe to call on an ad that is not loaded.
     */
    public Future<Void> dispose() {
        return instanceManager.disposeAd(this);
    }

    /**
     * Returns true if this ad has been loaded and the native side has reported it as loaded.
     */
    public boolean isLoaded() {
        return instanceManager.adIdFor(this) != null && instanceManager.onAdLoadedCalled(this);
    }

    protected AdInstanceManager getInstanceManager() {
        return instanceManager;
    }
}
