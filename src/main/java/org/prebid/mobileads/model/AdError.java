package org.prebid.mobileads.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Error information about why an ad operation failed.
 */
@Getter
@ToString
@EqualsAndHashCode
public class AdError {

    /**
     * Unique code to identify the error, as reported by the native SDK.
     */
    private final int code;

    /**
     * The domain from which the error came.
     */
    private final String domain;

    /**
     * A message detailing the error, for example "Account not approved yet".
     */
    private final String message;

    public AdError(int code, String domain, String message) {
        this.code = code;
        this.domain = domain;
        this.message = message;
    }
}
