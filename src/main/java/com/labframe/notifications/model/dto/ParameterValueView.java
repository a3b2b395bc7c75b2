package com.labframe.notifications.model.dto;

import java.time.LocalDateTime;

public record ParameterValueView(
    Long id,
    Long sampleId,
    String parameter,
    String value,
    String unit,
    LocalDateTime recordedAt
) {}
