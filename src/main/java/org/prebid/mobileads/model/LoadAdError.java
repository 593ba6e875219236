package org.prebid.mobileads.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Error that occurred while loading an ad.
 */
@Getter
@ToString(callSuper = true)
@EqualsAndHashCode(callSuper = true)
public class LoadAdError extends AdError {

    /**
     * Details of the failed ad request. Can be null.
     */
    private final ResponseInfo responseInfo;

    public LoadAdError(int code, String domain, String message, ResponseInfo responseInfo) {
        super(code, domain, message);
        this.responseInfo = responseInfo;
    }
}
