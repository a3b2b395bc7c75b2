package com.labframe.notifications.service;

import com.labframe.notifications.config.NotificationProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Picks the project a request targets: the {@code project} query parameter,
 * then the {@code X-Project} header, then the configured default project.
 */
@Component
@RequiredArgsConstructor
public class ProjectResolver {

    private final NotificationProperties properties;

    public String resolve(String queryProject, String headerProject) {
        if (StringUtils.hasText(queryProject)) {
            return queryProject.trim();
        }
        if (StringUtils.hasText(headerProject)) {
            return headerProject.trim();
        }
        return properties.getDefaultProject();
    }
}
