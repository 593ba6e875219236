package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.Ad;
import org.prebid.mobileads.model.AdError;

@FunctionalInterface
public interface AdErrorCallback<A extends Ad> {

    void onAdError(A ad, AdError error);
}
