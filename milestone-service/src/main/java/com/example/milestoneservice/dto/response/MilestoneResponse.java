package com.example.milestoneservice.dto.response;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Map;

/**
 * Response DTO for a milestone. Soft-delete metadata is never exposed.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneResponse {

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
