package org.prebid.mobileads.listener;

import org.prebid.mobileads.ad.RewardedAd;
import org.prebid.mobileads.model.RewardItem;

@FunctionalInterface
public interface OnUserEarnedRewardCallback {

    void onUserEarnedReward(RewardedAd ad, RewardItem reward);
}
