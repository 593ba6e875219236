package org.prebid.mobileads.model;

public enum Orientation {

    PORTRAIT, LANDSCAPE
}
