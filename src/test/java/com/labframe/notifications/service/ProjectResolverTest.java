package com.labframe.notifications.service;

import com.labframe.notifications.config.NotificationProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ProjectResolverTest {

    private ProjectResolver resolver;

    @BeforeEach
    void setUp() {
        NotificationProperties properties = new NotificationProperties();
        properties.setDefaultProject("bench");
        resolver = new ProjectResolver(properties);
    }

    @Test
    @DisplayName("Query parameter wins over the header")
    void queryParameterFirst() {
        assertThat(resolver.resolve("lab1", "lab2")).isEqualTo("lab1");
    }

    @Test
    @DisplayName("Header is used when no query parameter is given")
    void headerSecond() {
        assertThat(resolver.resolve(null, " lab2 ")).isEqualTo("lab2");
        assertThat(resolver.resolve("  ", "lab2")).isEqualTo("lab2");
    }

    @Test
    @DisplayName("Falls back to the default project")
    void defaultProjectLast() {
        assertThat(resolver.resolve(null, null)).isEqualTo("bench");
        assertThat(resolver.resolve("", "")).isEqualTo("bench");
    }
}
