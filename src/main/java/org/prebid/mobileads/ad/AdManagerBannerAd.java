package org.prebid.mobileads.ad;

import io.vertx.core.Future;
import org.apache.commons.collections4.CollectionUtils;
import org.prebid.mobileads.listener.AdManagerBannerAdListener;
import org.prebid.mobileads.manager.AdInstanceManager;
import org.prebid.mobileads.model.AdManagerAdRequest;
import org.prebid.mobileads.model.AdSize;

import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A banner ad served by Ad Manager.
 * <p>
 * Multiple sizes may be requested; until an ad is loaded the banner assumes the first one.
 */
public class AdManagerBannerAd extends AdWithView {

    private final List<AdSize> sizes;
    private final AdManagerAdRequest request;
    private final AdManagerBannerAdListener listener;

    public AdManagerBannerAd(AdInstanceManager instanceManager,
                             String adUnitId,
                             List<AdSize> sizes,
                             AdManagerAdRequest request,
                             AdManagerBannerAdListener listener) {

        super(instanceManager, adUnitId);
        if (CollectionUtils.isEmpty(sizes)) {
            throw new IllegalArgumentException("At least one ad size is required");
        }
        this.sizes = Collections.unmodifiableList(sizes);
        this.request = Objects.requireNonNull(request);
        this.listener = Objects.requireNonNull(listener);
    }

    public List<AdSize> getSizes() {
        return sizes;
    }

    public AdManagerAdRequest getRequest() {
        return request;
    }

    @Override
    public AdManagerBannerAdListener getListener() {
        return listener;
    }

    @Override
    public Future<Void> load() {
        return getInstanceManager().loadAdManagerBannerAd(this);
    }
}
