package com.labframe.notifications.model.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RecordParametersRequest {

    private List<ParameterAssignment> parameters = new ArrayList<>();

    public RecordParametersRequest(List<ParameterAssignment> parameters) {
        this.parameters = parameters;
    }

    /**
     * One value to record. The unit is optional.
     */
    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ParameterAssignment {
        private String name;
        private String value;
        private String unit;

        public ParameterAssignment(String name, String value, String unit) {
            this.name = name;
            this.value = value;
            this.unit = unit;
        }
    }
}
