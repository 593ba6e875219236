package org.prebid.mobileads.listener;

/**
 * Capability of receiving Ad Manager app events.
 */
public interface AppEventListener {

    AppEventCallback getOnAppEvent();

    static AppEventListener of(AppEventCallback onAppEvent) {
        return () -> onAppEvent;
    }
}
