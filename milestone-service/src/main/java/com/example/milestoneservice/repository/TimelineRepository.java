package com.example.milestoneservice.repository;

import com.example.milestoneservice.entity.Timeline;
import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;

/**
 * Repository for Timeline entity.
 * Note: @SQLRestriction on Timeline automatically filters soft-deleted records.
 */
@Repository
public interface TimelineRepository extends JpaRepository<Timeline, Long> {

    @Query("SELECT t FROM Timeline t WHERE t.id = :id AND t.deletedAt IS NULL")
    Optional<Timeline> findByIdAndNotDeleted(@Param("id") Long id);

    /**
     * Find timeline and take a row lock on it.
     * Every milestone update locks its timeline first, so two updates on the same
     * timeline cannot interleave their reorder/cascade phases.
     */
    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("SELECT t FROM Timeline t WHERE t.id = :id AND t.deletedAt IS NULL")
    Optional<Timeline> findByIdForUpdate(@Param("id") Long id);
}
