package org.prebid.mobileads.model;

import lombok.Value;

import java.util.Objects;

/**
 * Size of a banner ad.
 * <p>
 * Smart banner sizes are encoded with negative dimensions, which is what the native SDKs expect.
 */
@Value(staticConstructor = "of")
public class AdSize {

    public static final AdSize BANNER = AdSize.of(320, 50);
    public static final AdSize LARGE_BANNER = AdSize.of(320, 100);
    public static final AdSize MEDIUM_RECTANGLE = AdSize.of(300, 250);
    public static final AdSize FULL_BANNER = AdSize.of(468, 60);
    public static final AdSize LEADERBOARD = AdSize.of(728, 90);

    public static final AdSize SMART_BANNER = AdSize.of(-1, -1);
    public static final AdSize SMART_BANNER_PORTRAIT = AdSize.of(-1, -2);
    public static final AdSize SMART_BANNER_LANDSCAPE = AdSize.of(-1, -3);

    int width;

    int height;

    /**
     * Returns the screen-width banner size of the given platform and orientation.
     * <p>
     * Android uses a single smart banner size for both orientations.
     */
    public static AdSize getSmartBanner(Platform platform, Orientation orientation) {
        Objects.requireNonNull(platform);
        Objects.requireNonNull(orientation);

        if (platform == Platform.ANDROID) {
            return SMART_BANNER;
        }
        return orientation == Orientation.PORTRAIT ? SMART_BANNER_PORTRAIT : SMART_BANNER_LANDSCAPE;
    }
}
