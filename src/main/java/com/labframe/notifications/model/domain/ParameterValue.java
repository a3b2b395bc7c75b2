package com.labframe.notifications.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.time.LocalDateTime;

/**
 * One recorded value of a parameter for a sample.
 *
 * Rows are append-only. The generated id only ever grows, so the highest id of
 * a project doubles as that project's change marker.
 */
@Getter
@Setter
@Entity
@Table(name = "sample_param_value",
        indexes = @Index(name = "idx_spv_project_id", columnList = "project, id"))
public class ParameterValue {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false)
    private String project;

    @Column(name = "sample_id", nullable = false)
    private Long sampleId;

    @ManyToOne(fetch = FetchType.LAZY, optional = false)
    @JoinColumn(name = "param_id", nullable = false)
    private ParameterDefinition definition;

    @Column(name = "value_text", length = 1024)
    private String value;

    @Column(name = "unit_symbol")
    private String unit;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt = LocalDateTime.now();

    public ParameterValue() {
    }

    public ParameterValue(String project, Long sampleId, ParameterDefinition definition, String value, String unit) {
        this.project = project;
        this.sampleId = sampleId;
        this.definition = definition;
        this.value = value;
        this.unit = unit;
        this.recordedAt = LocalDateTime.now();
    }
}
