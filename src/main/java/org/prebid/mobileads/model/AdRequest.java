package org.prebid.mobileads.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Targeting info of an AdMob ad request.
 */
@Value
public class AdRequest {

    private static final AdRequest EMPTY = AdRequest.builder().build();

    /**
     * Words or phrases describing the current user activity.
     */
    List<String> keywords;

    /**
     * URL of a page whose content matches the app's primary content, used for targeting and brand safety.
     */
    String contentUrl;

    /**
     * Requests ads that are not based on the user's past behavior.
     */
    Boolean nonPersonalizedAds;

    @Builder(toBuilder = true)
    private AdRequest(List<String> keywords, String contentUrl, Boolean nonPersonalizedAds) {
        this.keywords = keywords != null ? Collections.unmodifiableList(new ArrayList<>(keywords)) : null;
        this.contentUrl = contentUrl;
        this.nonPersonalizedAds = nonPersonalizedAds;
    }

    public static AdRequest empty() {
        return EMPTY;
    }
}
