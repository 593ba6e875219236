package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.Ad;
import org.prebid.mobileads.model.LoadAdError;

@FunctionalInterface
public interface AdLoadErrorCallback<A extends Ad> {

    void onAdFailedToLoad(A ad, LoadAdError error);
}
