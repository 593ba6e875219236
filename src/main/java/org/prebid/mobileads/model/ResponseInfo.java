package org.prebid.mobileads.model;

import lombok.Builder;
import lombok.Value;

/**
 * Information about the loaded ad or the ad request, for debugging and logging purposes.
 */
@Builder(toBuilder = true)
@Value
public class ResponseInfo {

    String responseId;

    String mediationAdapterClassName;
}
