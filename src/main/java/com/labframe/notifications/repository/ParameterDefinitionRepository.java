package com.labframe.notifications.repository;

import com.labframe.notifications.model.domain.ParameterDefinition;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
public interface ParameterDefinitionRepository extends JpaRepository<ParameterDefinition, Long> {

    Optional<ParameterDefinition> findByProjectAndName(String project, String name);
}
