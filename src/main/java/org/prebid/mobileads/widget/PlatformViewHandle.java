package org.prebid.mobileads.widget;

import lombok.Value;
import org.prebid.mobileads.model.Platform;

/**
 * What the host UI needs to embed the native view of an ad: the registered view type and the ad id passed as
 * the view creation parameter.
 */
@Value(staticConstructor = "of")
public class PlatformViewHandle {

    String viewType;

    int adId;

    Platform platform;
}
