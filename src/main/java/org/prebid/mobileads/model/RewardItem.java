package org.prebid.mobileads.model;

import lombok.Value;

import java.math.BigDecimal;

/**
 * Credit information about a reward received from a rewarded ad.
 */
@Value(staticConstructor = "of")
public class RewardItem {

    BigDecimal amount;

    String type;
}
