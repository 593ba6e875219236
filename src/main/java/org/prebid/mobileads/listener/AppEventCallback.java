package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.Ad;

/**
 * Receives app events sent by Ad Manager creatives.
 */
@FunctionalInterface
public interface AppEventCallback {

    void onAppEvent(Ad ad, String name, String data);
}
