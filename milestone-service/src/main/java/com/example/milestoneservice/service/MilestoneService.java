package com.example.milestoneservice.service;

import com.example.milestoneservice.dto.request.UpdateMilestoneRequest;
import com.example.milestoneservice.dto.response.MilestoneResponse;

import java.util.List;

/**
 * Service interface for milestone operations.
 */
public interface MilestoneService {

    /**
     * Apply a partial update to one milestone and restore the timeline invariants.
     *
     * Runs as one transaction: field merge, sibling reorder and date cascade either
     * all commit or all roll back. A single milestone.updated event carrying the
     * before/after state of the targeted milestone is published after commit.
     *
     * @param timelineId owning timeline
     * @param milestoneId milestone to update
     * @param request partial update; absent fields are left unchanged
     * @param updatedBy id of the authenticated caller
     * @return final persisted state of the targeted milestone
     */
    MilestoneResponse updateMilestone(Long timelineId, Long milestoneId,
                                      UpdateMilestoneRequest request, Long updatedBy);

    MilestoneResponse getMilestone(Long timelineId, Long milestoneId);

    /**
     * Non-deleted milestones of a timeline in order.
     */
    List<MilestoneResponse> listMilestones(Long timelineId);
}
