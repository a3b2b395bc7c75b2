package com.labframe.notifications.service.realtime;

/**
 * Raised when a project's datastore could not be read during change detection.
 * The detector's high-water mark is left as it was.
 */
public class ChangeDetectionException extends RuntimeException {

    private final String project;

    public ChangeDetectionException(String project, Throwable cause) {
        super("Change detection failed for project '" + project + "': " + cause.getMessage(), cause);
        this.project = project;
    }

    public String getProject() {
        return project;
    }
}
