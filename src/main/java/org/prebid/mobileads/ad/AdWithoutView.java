package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.AdLoadCallback;
import org.prebid.mobileads.listener.FullScreenContentCallback;
import org.prebid.mobileads.manager.AdInstanceManager;

import java.util.Objects;

/**
 * Base class of ads overlaid on top of the host UI.
 *
 * @param <A> the concrete ad type, passed back to the callbacks
 */
public abstract class AdWithoutView<A extends AdWithoutView<A>> extends Ad {

    private final AdLoadCallback<A> adLoadCallback;

    private volatile FullScreenContentCallback<A> fullScreenContentCallback;

    protected AdWithoutView(AdInstanceManager instanceManager, String adUnitId, AdLoadCallback<A> adLoadCallback) {
        super(instanceManager, adUnitId);
        this.adLoadCallback = Objects.requireNonNull(adLoadCallback);
    }

    public AdLoadCallback<A> getAdLoadCallback() {
        return adLoadCallback;
    }

    public FullScreenContentCallback<A> getFullScreenContentCallback() {
        return fullScreenContentCallback;
    }

    /**
     * Sets the callbacks notified when this ad shows and dismisses full screen content. Should be set before
     * {@link #show()}.
     */
    public void setFullScreenContentCallback(FullScreenContentCallback<A> fullScreenContentCallback) {
        this.fullScreenContentCallback = fullScreenContentCallback;
    }

    /**
     * Displays this ad on top of the application.
     *
     * @throws IllegalStateException if the ad has not been loaded or has been disposed
     */
    public Future<Void> show() {
        return getInstanceManager().showAdWithoutView(this);
    }
}
