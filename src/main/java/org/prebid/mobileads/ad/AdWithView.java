package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.prebid.mobileads.listener.AdWithViewListener;
import org.prebid.mobileads.manager.AdInstanceManager;

/**
 * Base class of ads displayed inline, as a view placed in the host UI tree.
 */
public abstract class AdWithView extends Ad {

    protected AdWithView(AdInstanceManager instanceManager, String adUnitId) {
        super(instanceManager, adUnitId);
    }

    public abstract AdWithViewListener getListener();

    /**
     * Starts loading this ad. The returned future completes when the request is accepted by the native side,
     * the outcome is reported to the {@link #getListener()}.
     * <p>
     * Loading an ad that is already loaded does nothing.
     */
    public abstract Future<Void> load();
}
