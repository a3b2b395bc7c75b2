package com.labframe.notifications.model.domain;

import jakarta.persistence.*;
import lombok.Getter;
import lombok.Setter;

import java.util.Objects;

/**
 * A named parameter of a project. The name is the unit of change that
 * subscribers are notified about.
 */
@Getter
@Setter
@Entity
@Table(name = "param_def",
        uniqueConstraints = @UniqueConstraint(columnNames = {"project", "name"}))
public class ParameterDefinition {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "param_id")
    private Long id;

    @Column(nullable = false)
    private String project;

    @Column(nullable = false)
    private String name;

    public ParameterDefinition() {
    }

    public ParameterDefinition(String project, String name) {
        this.project = project;
        this.name = name;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterDefinition that = (ParameterDefinition) o;
        return Objects.equals(project, that.project) && Objects.equals(name, that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(project, name);
    }

    @Override
    public String toString() {
        return "ParameterDefinition{" +
                "id=" + id +
                ", project='" + project + '\'' +
                ", name='" + name + '\'' +
                '}';
    }
}
