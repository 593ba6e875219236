package org.prebid.mobileads.model;

import java.util.Arrays;

/**
 * Maximum content rating of ads returned for the app.
 */
public enum MaxAdContentRating {

    G("G"),
    PG("PG"),
    T("T"),
    MA("MA");

    private final String value;

    MaxAdContentRating(String value) {
        this.value = value;
    }

    public String value() {
        return value;
    }

    public static MaxAdContentRating fromValue(String value) {
        return Arrays.stream(values())
                .filter(rating -> rating.value.equals(value))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown max ad content rating: " + value));
    }
}
