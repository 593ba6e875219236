package org.prebid.mobileads.exception;

import lombok.Getter;

import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Thrown when an ad widget is inserted into the view tree in a state it cannot be displayed in.
 */
@Getter
@SuppressWarnings("serial")
public class AdWidgetException extends IllegalStateException {

    private final String summary;

    private final List<String> hints;

    public AdWidgetException(String summary, List<String> hints) {
        super(format(summary, hints));
        this.summary = summary;
        this.hints = Collections.unmodifiableList(hints);
    }

    private static String format(String summary, List<String> hints) {
        return hints.stream()
                .map(hint -> "\n" + hint)
                .collect(Collectors.joining("", summary, ""));
    }
}
