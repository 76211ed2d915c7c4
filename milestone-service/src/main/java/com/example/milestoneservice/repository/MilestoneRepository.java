package com.example.milestoneservice.repository;

import com.example.milestoneservice.entity.Milestone;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for Milestone entity.
 * All queries are scoped to one timeline and exclude soft-deleted rows.
 */
@Repository
public interface MilestoneRepository extends JpaRepository<Milestone, Long> {

    @Query("SELECT m FROM Milestone m WHERE m.id = :id AND m.timelineId = :timelineId " +
           "AND m.deletedAt IS NULL")
    Optional<Milestone> findByIdAndTimelineId(@Param("id") Long id,
                                              @Param("timelineId") Long timelineId);

    /**
     * Find milestone with pessimistic lock, for the update path.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT m FROM Milestone m WHERE m.id = :id AND m.timelineId = :timelineId " +
           "AND m.deletedAt IS NULL")
    Optional<Milestone> findByIdAndTimelineIdForUpdate(@Param("id") Long id,
                                                       @Param("timelineId") Long timelineId);

    /**
     * All milestones of a timeline in execution order.
     */
    @Query("SELECT m FROM Milestone m WHERE m.timelineId = :timelineId AND m.deletedAt IS NULL " +
           "ORDER BY m.sortOrder ASC")
    List<Milestone> findAllByTimelineIdOrdered(@Param("timelineId") Long timelineId);

    /**
     * Siblings whose order lies in [fromOrder, toOrder], excluding the given milestone.
     * Used by the reorder resolver to find the rows a move displaces.
     */
    @Query("SELECT m FROM Milestone m WHERE m.timelineId = :timelineId AND m.id <> :excludedId " +
           "AND m.sortOrder BETWEEN :fromOrder AND :toOrder AND m.deletedAt IS NULL " +
           "ORDER BY m.sortOrder ASC")
    List<Milestone> findSiblingsInOrderRange(@Param("timelineId") Long timelineId,
                                             @Param("excludedId") Long excludedId,
                                             @Param("fromOrder") int fromOrder,
                                             @Param("toOrder") int toOrder);

    /**
     * Milestones scheduled after the given order, ascending.
     * Used by the cascade scheduler.
     */
    @Query("SELECT m FROM Milestone m WHERE m.timelineId = :timelineId " +
           "AND m.sortOrder > :sortOrder AND m.deletedAt IS NULL " +
           "ORDER BY m.sortOrder ASC")
    List<Milestone> findAllAfterOrder(@Param("timelineId") Long timelineId,
                                      @Param("sortOrder") int sortOrder);
}
