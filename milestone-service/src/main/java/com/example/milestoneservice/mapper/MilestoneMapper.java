package com.example.milestoneservice.mapper;

import com.example.common.events.MilestoneSnapshot;
import com.example.milestoneservice.dto.response.MilestoneResponse;
import com.example.milestoneservice.entity.Milestone;
import com.example.milestoneservice.util.JsonObjects;
import org.springframework.stereotype.Component;

/**
 * Maps Milestone entities to API responses and event snapshots.
 * deletedAt/deletedBy are dropped in both directions.
 */
@Component
public class MilestoneMapper {

    public MilestoneResponse toResponse(Milestone milestone) {
        return MilestoneResponse.builder()
                .id(milestone.getId())
                .timelineId(milestone.getTimelineId())
                .sortOrder(milestone.getSortOrder())
                .duration(milestone.getDuration())
                .startDate(milestone.getStartDate())
                .endDate(milestone.getEndDate())
                .completionDate(milestone.getCompletionDate())
                .name(milestone.getName())
                .description(milestone.getDescription())
                .status(milestone.getStatus())
                .type(milestone.getType())
                .plannedText(milestone.getPlannedText())
                .activeText(milestone.getActiveText())
                .completedText(milestone.getCompletedText())
                .blockedText(milestone.getBlockedText())
                .hidden(milestone.getHidden())
                .details(JsonObjects.deepCopy(milestone.getDetails()))
                .createdBy(milestone.getCreatedBy())
                .updatedBy(milestone.getUpdatedBy())
                .createdAt(milestone.getCreatedAt())
                .updatedAt(milestone.getUpdatedAt())
                .build();
    }

    /**
     * Detached copy of the entity state, safe to hold across later mutations.
     */
    public MilestoneSnapshot toSnapshot(Milestone milestone) {
        return MilestoneSnapshot.builder()
                .id(milestone.getId())
                .timelineId(milestone.getTimelineId())
                .sortOrder(milestone.getSortOrder())
                .duration(milestone.getDuration())
                .startDate(milestone.getStartDate())
                .endDate(milestone.getEndDate())
                .completionDate(milestone.getCompletionDate())
                .name(milestone.getName())
                .description(milestone.getDescription())
                .status(milestone.getStatus())
                .type(milestone.getType())
                .plannedText(milestone.getPlannedText())
                .activeText(milestone.getActiveText())
                .completedText(milestone.getCompletedText())
                .blockedText(milestone.getBlockedText())
                .hidden(milestone.getHidden())
                .details(JsonObjects.deepCopy(milestone.getDetails()))
                .createdBy(milestone.getCreatedBy())
                .updatedBy(milestone.getUpdatedBy())
                .createdAt(milestone.getCreatedAt())
                .updatedAt(milestone.getUpdatedAt())
                .build();
    }
}
