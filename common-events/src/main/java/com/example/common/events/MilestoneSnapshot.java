package com.example.common.events;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Point-in-time view of a milestone carried inside {@link MilestoneUpdatedEvent}.
 * Soft-delete metadata (deletedAt, deletedBy) is never part of a snapshot.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class MilestoneSnapshot implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;

    private Long timelineId;

    @JsonProperty("order")
    private Integer sortOrder;

    private Integer duration;

    private LocalDate startDate;

    private LocalDate endDate;

    private LocalDate completionDate;

    private String name;

    private String description;

    private String status;

    private String type;

    private String plannedText;

    private String activeText;

    private String completedText;

    private String blockedText;

    private Boolean hidden;

    private Map<String, Object> details;

    private Long createdBy;

    private Long updatedBy;

    private Instant createdAt;

    private Instant updatedAt;
}
