package com.labframe.notifications.model.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Payload of a data frame on the change stream.
 *
 * Serialises to {@code {"type":"connected"}} or
 * {@code {"type":"parameter_values_changed","parameters":[...]}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "parameters"})
public record ChangeNotification(String type, List<String> parameters) {

    public static final String CONNECTED = "connected";
    public static final String PARAMETER_VALUES_CHANGED = "parameter_values_changed";

    public static ChangeNotification connected() {
        return new ChangeNotification(CONNECTED, null);
    }

    public static ChangeNotification parameterValuesChanged(List<String> parameters) {
        return new ChangeNotification(PARAMETER_VALUES_CHANGED, List.copyOf(parameters));
    }
}
