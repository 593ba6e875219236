package org.prebid.mobileads.model;

/**
 * Whether ad requests should be treated as child-directed for the purposes of COPPA.
 */
public enum TagForChildDirectedTreatment {

    UNSPECIFIED(-1),
    NO(0),
    YES(1);

    private final int value;

    TagForChildDirectedTreatment(int value) {
        this.value = value;
    }

    public int value() {
        return value;
    }
}
