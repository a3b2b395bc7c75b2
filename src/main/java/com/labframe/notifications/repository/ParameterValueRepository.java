package com.labframe.notifications.repository;

import com.labframe.notifications.model.domain.ParameterValue;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParameterValueRepository extends JpaRepository<ParameterValue, Long> {

    /**
     * Highest value id recorded for a project, or 0 when the project has no values yet.
     *
     * @param project The project key.
     * @return The current change marker of the project.
     */
    @Query("select coalesce(max(v.id), 0) from ParameterValue v where v.project = :project")
    long findMaxIdByProject(@Param("project") String project);

    /**
     * Distinct names of the parameters whose values were recorded in the id range
     * {@code (after, upTo]}, sorted by name.
     *
     * @param project The project key.
     * @param after   Exclusive lower bound (the last marker already reported).
     * @param upTo    Inclusive upper bound (the marker read in the same poll).
     * @return Sorted parameter names without duplicates.
     */
    @Query("select distinct d.name from ParameterValue v join v.definition d " +
            "where v.project = :project and v.id > :after and v.id <= :upTo order by d.name")
    List<String> findParameterNamesChangedBetween(@Param("project") String project,
                                                  @Param("after") long after,
                                                  @Param("upTo") long upTo);

    @Query("select v from ParameterValue v join fetch v.definition d " +
            "where v.project = :project and d.name = :name order by v.id desc")
    List<ParameterValue> findHistory(@Param("project") String project,
                                     @Param("name") String name,
                                     Pageable pageable);
}
