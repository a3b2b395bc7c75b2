package com.labframe.notifications.service.realtime;

import java.util.List;

/**
 * Read-only view of a project's datastore that change detection relies on.
 *
 * Implementations may throw {@link org.springframework.dao.DataAccessException}
 * from either method.
 */
public interface ChangeMarkerSource {

    /**
     * @param project The project key.
     * @return The highest change marker currently stored for the project, 0 when empty.
     */
    long currentChangeMarker(String project);

    /**
     * @param project The project key.
     * @param marker  Exclusive lower bound, the last marker already accounted for.
     * @param upTo    Inclusive upper bound, the marker read in the same detection.
     * @return Distinct topic names touched in {@code (marker, upTo]}, sorted ascending.
     */
    List<String> topicsChangedSince(String project, long marker, long upTo);
}
