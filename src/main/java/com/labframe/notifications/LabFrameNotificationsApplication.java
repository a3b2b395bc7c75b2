package com.labframe.notifications;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Application entry point. The change poller is a lifecycle bean, so it is
 * started after the context refreshes and stopped before it closes.
 */
@SpringBootApplication
@EnableScheduling // periodic statistics logging
@ConfigurationPropertiesScan // binds labframe.notifications.* onto NotificationProperties
public class LabFrameNotificationsApplication {

    public static void main(String[] args) {
        SpringApplication.run(LabFrameNotificationsApplication.class, args);
    }
}
