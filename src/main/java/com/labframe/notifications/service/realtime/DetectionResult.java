package com.labframe.notifications.service.realtime;

import java.util.List;

/**
 * Outcome of one change detection: whether the marker moved and which topics were touched.
 */
public record DetectionResult(boolean changed, List<String> topics) {

    public static final DetectionResult NONE = new DetectionResult(false, List.of());

    public static DetectionResult changed(List<String> topics) {
        return new DetectionResult(true, List.copyOf(topics));
    }
}
