package com.example.milestoneservice.controller;

import com.example.milestoneservice.dto.request.UpdateMilestoneEnvelope;
import com.example.milestoneservice.dto.response.ApiResponse;
import com.example.milestoneservice.dto.response.MilestoneResponse;
import com.example.milestoneservice.security.CurrentUser;
import com.example.milestoneservice.service.MilestoneService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * REST controller for timeline milestones.
 *
 * Base path: /api/timelines/{timelineId}/milestones
 * Authentication: JWT Bearer token
 * Editing (milestone.edit) is limited to ADMIN, MANAGER and COPILOT.
 */
@RestController
@RequestMapping("/api/timelines/{timelineId}/milestones")
@RequiredArgsConstructor
@Slf4j
public class MilestoneController {

    private final MilestoneService milestoneService;

    /**
     * PATCH /api/timelines/{timelineId}/milestones/{milestoneId}
     * Partial update; reorders siblings and reschedules later milestones as needed.
     */
    @PatchMapping("/{milestoneId}")
    @PreAuthorize("hasAnyRole('ADMIN', 'MANAGER', 'COPILOT')")
    public ResponseEntity<ApiResponse<MilestoneResponse>> updateMilestone(
            @PathVariable Long timelineId,
            @PathVariable Long milestoneId,
            @Valid @RequestBody UpdateMilestoneEnvelope body,
            @AuthenticationPrincipal CurrentUser currentUser) {

        log.info("PATCH milestone {} of timeline {} by user {}", milestoneId, timelineId, currentUser.getUserId());

        MilestoneResponse response = milestoneService.updateMilestone(
                timelineId, milestoneId, body.getParam(), currentUser.getUserId());
        return ResponseEntity.ok(ApiResponse.success(response));
    }

    @GetMapping("/{milestoneId}")
    public ResponseEntity<ApiResponse<MilestoneResponse>> getMilestone(
            @PathVariable Long timelineId,
            @PathVariable Long milestoneId) {

        return ResponseEntity.ok(ApiResponse.success(milestoneService.getMilestone(timelineId, milestoneId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<List<MilestoneResponse>>> listMilestones(
            @PathVariable Long timelineId) {

        return ResponseEntity.ok(ApiResponse.success(milestoneService.listMilestones(timelineId)));
    }
}
