package org.prebid.mobileads.model;

import lombok.Builder;
import lombok.Value;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Global configuration applied to every ad request made by the native SDK.
 */
@Value
public class RequestConfiguration {

    MaxAdContentRating maxAdContentRating;

    TagForChildDirectedTreatment tagForChildDirectedTreatment;

    TagForUnderAgeOfConsent tagForUnderAgeOfConsent;

    List<String> testDeviceIds;

    @Builder(toBuilder = true)
    private RequestConfiguration(MaxAdContentRating maxAdContentRating,
                                 TagForChildDirectedTreatment tagForChildDirectedTreatment,
                                 TagForUnderAgeOfConsent tagForUnderAgeOfConsent,
                                 List<String> testDeviceIds) {

        this.maxAdContentRating = maxAdContentRating;
        this.tagForChildDirectedTreatment = tagForChildDirectedTreatment;
        this.tagForUnderAgeOfConsent = tagForUnderAgeOfConsent;
        this.testDeviceIds = testDeviceIds != null
                ? Collections.unmodifiableList(new ArrayList<>(testDeviceIds))
                : null;
    }
}
