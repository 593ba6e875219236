package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.Ad;

@FunctionalInterface
public interface AdEventCallback<A extends Ad> {

    void onAdEvent(A ad);
}
