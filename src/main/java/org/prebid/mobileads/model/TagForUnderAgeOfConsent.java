package org.prebid.mobileads.model;

/**
 * Whether ad requests should be treated as coming from users under the age of consent.
 */
public enum TagForUnderAgeOfConsent {

    UNSPECIFIED(-1),
    NO(0),
    YES(1);

    private final int value;

    TagForUnderAgeOfConsent(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
