package org.prebid.mobileads.model;

public enum Platform {

    ANDROID, IOS
}
