package org.prebid.mobileads.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Targeting info of an Ad Manager ad request.
 */
@Value
public class AdManagerAdRequest {

    private static final AdManagerAdRequest EMPTY = AdManagerAdRequest.builder().build();

    List<String> keywords;

    String contentUrl;

    Map<String, String> customTargeting;

    Map<String, List<String>> customTargetingLists;

    Boolean nonPersonalizedAds;

    @Builder(toBuilder = true)
    private AdManagerAdRequest(List<String> keywords,
                               String contentUrl,
                               Map<String, String> customTargeting,
                               Map<String, List<String>> customTargetingLists,
                               Boolean nonPersonalizedAds) {

        this.keywords = keywords != null ? Collections.unmodifiableList(new ArrayList<>(keywords)) : null;
        this.contentUrl = contentUrl;
        this.customTargeting = customTargeting != null
                ? Collections.unmodifiableMap(new LinkedHashMap<>(customTargeting))
                : null;
        this.customTargetingLists = customTargetingLists != null ? copyOf(customTargetingLists) : null;
        this.nonPersonalizedAds = nonPersonalizedAds;
    }

    public static AdManagerAdRequest empty() {
        return EMPTY;
    }

    private static Map<String, List<String>> copyOf(Map<String, List<String>> customTargetingLists) {
        final Map<String, List<String>> copy = new LinkedHashMap<>();
        customTargetingLists.forEach((key, values) ->
                copy.put(key, values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : null));
        return Collections.unmodifiableMap(copy);
    }
}
