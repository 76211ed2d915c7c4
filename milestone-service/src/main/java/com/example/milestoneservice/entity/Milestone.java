package com.example.milestoneservice.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.SQLRestriction;

import java.time.Instant;
import java.time.LocalDate;
import java.util.HashMap;
import java.util.Map;

/**
 * Milestone entity: a time-boxed work item inside a timeline.
 *
 * Scheduling fields:
 * - sortOrder: dense, unique rank among non-deleted siblings (JSON name "order")
 * - startDate: day after the predecessor's effective end, never set by callers
 * - endDate: always startDate + duration - 1 day
 * - completionDate: when present, replaces endDate as the effective end
 *
 * timelineId is a plain Long reference (no JPA association); traversal is always
 * by (timelineId, sortOrder).
 * Soft-deleted rows are filtered by @SQLRestriction and never take part in
 * reorder or cascade computations.
 */
@Entity
@Table(name = "milestones")
@SQLRestriction("deleted_at IS NULL")
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Milestone {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id", nullable = false)
    private Long id;

    @Column(name = "timeline_id", nullable = false, updatable = false)
    private Long timelineId;

    @Column(name = "sort_order", nullable = false)
    private Integer sortOrder;

    @Column(name = "duration", nullable = false)
    private Integer duration;

    @Column(name = "start_date", nullable = false)
    private LocalDate startDate;

    @Column(name = "end_date", nullable = false)
    private LocalDate endDate;

    @Column(name = "completion_date")
    private LocalDate completionDate;

    @Column(name = "name", nullable = false, length = 255)
    private String name;

    @Column(name = "description", length = 255)
    private String description;

    @Column(name = "status", nullable = false, length = 45)
    private String status;

    @Column(name = "type", nullable = false, length = 45)
    private String type;

    @Column(name = "planned_text", length = 512)
    private String plannedText;

    @Column(name = "active_text", length = 512)
    private String activeText;

    @Column(name = "completed_text", length = 512)
    private String completedText;

    @Column(name = "blocked_text", length = 512)
    private String blockedText;

    @Column(name = "hidden", nullable = false)
    @Builder.Default
    private Boolean hidden = false;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "details", length = 10000)
    @Builder.Default
    private Map<String, Object> details = new HashMap<>();

    @Column(name = "created_by")
    private Long createdBy;

    @Column(name = "updated_by")
    private Long updatedBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    @Column(name = "deleted_at")
    private Instant deletedAt;

    @Column(name = "deleted_by")
    private Long deletedBy;

    @Version
    @Column(name = "version")
    private Integer version;

    @PrePersist
    protected void onCreate() {
        createdAt = Instant.now();
        updatedAt = Instant.now();
    }

    @PreUpdate
    protected void onUpdate() {
        updatedAt = Instant.now();
    }

    /**
     * The date the next sibling's schedule is computed from:
     * completionDate when set, otherwise endDate.
     */
    public LocalDate effectiveEndDate() {
        return completionDate != null ? completionDate : endDate;
    }

    /**
     * Reschedule this milestone to begin on the given day, keeping its duration.
     */
    public void rescheduleFrom(LocalDate newStartDate) {
        this.startDate = newStartDate;
        this.endDate = endDateFor(newStartDate, duration);
    }

    /**
     * Last day of a milestone of the given duration starting on startDate.
     */
    public static LocalDate endDateFor(LocalDate startDate, int duration) {
        return startDate.plusDays(duration - 1L);
    }
}
