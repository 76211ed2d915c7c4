package com.example.milestoneservice.service.impl;

import com.example.common.events.MilestoneSnapshot;
import com.example.common.events.MilestoneUpdatedEvent;
import com.example.milestoneservice.dto.request.UpdateMilestoneRequest;
import com.example.milestoneservice.dto.response.MilestoneResponse;
import com.example.milestoneservice.entity.Milestone;
import com.example.milestoneservice.exception.ResourceNotFoundException;
import com.example.milestoneservice.exception.ValidationConflictException;
import com.example.milestoneservice.mapper.MilestoneMapper;
import com.example.milestoneservice.repository.MilestoneRepository;
import com.example.milestoneservice.repository.TimelineRepository;
import com.example.milestoneservice.security.CorrelationIdFilter;
import com.example.milestoneservice.service.CascadeScheduler;
import com.example.milestoneservice.service.MilestoneService;
import com.example.milestoneservice.service.OrderShift;
import com.example.milestoneservice.service.ReorderResolver;
import com.example.milestoneservice.service.ScheduleWrite;
import com.example.milestoneservice.util.JsonObjects;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * Implementation of MilestoneService.
 * Orchestrates validate -> merge -> reorder -> cascade -> notify for one milestone update.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class MilestoneServiceImpl implements MilestoneService {

    private final MilestoneRepository milestoneRepository;
    private final TimelineRepository timelineRepository;
    private final ReorderResolver reorderResolver;
    private final CascadeScheduler cascadeScheduler;
    private final MilestoneMapper milestoneMapper;
    private final ApplicationEventPublisher eventPublisher;

    @Override
    @Transactional
    public MilestoneResponse updateMilestone(Long timelineId, Long milestoneId,
                                             UpdateMilestoneRequest request, Long updatedBy) {
        log.info("Updating milestone: timelineId={}, milestoneId={}, updatedBy={}",
                timelineId, milestoneId, updatedBy);

        // Timeline lock serializes concurrent updates of the same timeline
        timelineRepository.findByIdForUpdate(timelineId)
                .orElseThrow(() -> ResourceNotFoundException.timelineNotFound(timelineId));

        Milestone milestone = milestoneRepository.findByIdAndTimelineIdForUpdate(milestoneId, timelineId)
                .orElseThrow(() -> ResourceNotFoundException.milestoneNotFound(milestoneId));

        if (request.getCompletionDate() != null
                && request.getCompletionDate().isBefore(milestone.getStartDate())) {
            throw ValidationConflictException.completionBeforeStart(
                    request.getCompletionDate(), milestone.getStartDate());
        }

        MilestoneSnapshot original = milestoneMapper.toSnapshot(milestone);
        int originalOrder = milestone.getSortOrder();
        int originalDuration = milestone.getDuration();
        LocalDate originalCompletionDate = milestone.getCompletionDate();

        applyChanges(milestone, request);
        milestone.setUpdatedBy(updatedBy);
        Milestone saved = milestoneRepository.saveAndFlush(milestone);

        if (saved.getSortOrder() != originalOrder) {
            List<OrderShift> shifts = reorderResolver.resolve(
                    timelineId, saved.getId(), originalOrder, saved.getSortOrder());
            reorderResolver.applyShifts(shifts);
            log.info("Reordered milestone: milestoneId={}, {} -> {}, shiftedSiblings={}",
                    saved.getId(), originalOrder, saved.getSortOrder(), shifts.size());
        }

        // An order-only move does not change the effective end, so no cascade
        boolean scheduleChanged = saved.getDuration() != originalDuration
                || !Objects.equals(originalCompletionDate, saved.getCompletionDate());
        if (scheduleChanged) {
            List<ScheduleWrite> writes = cascadeScheduler.cascade(saved);
            log.debug("Cascade after milestone update: milestoneId={}, writes={}",
                    saved.getId(), writes.size());
        }

        MilestoneSnapshot updated = milestoneMapper.toSnapshot(saved);

        // Delivered to Kafka only after this transaction commits
        eventPublisher.publishEvent(MilestoneUpdatedEvent.builder()
                .original(original)
                .updated(updated)
                .correlationId(MDC.get(CorrelationIdFilter.MDC_KEY))
                .eventId(UUID.randomUUID().toString())
                .eventTimestamp(Instant.now())
                .build());

        log.info("Milestone updated successfully: milestoneId={}", saved.getId());
        return milestoneMapper.toResponse(saved);
    }

    @Override
    public MilestoneResponse getMilestone(Long timelineId, Long milestoneId) {
        log.info("Getting milestone: timelineId={}, milestoneId={}", timelineId, milestoneId);

        timelineRepository.findByIdAndNotDeleted(timelineId)
                .orElseThrow(() -> ResourceNotFoundException.timelineNotFound(timelineId));

        return milestoneRepository.findByIdAndTimelineId(milestoneId, timelineId)
                .map(milestoneMapper::toResponse)
                .orElseThrow(() -> ResourceNotFoundException.milestoneNotFound(milestoneId));
    }

    @Override
    public List<MilestoneResponse> listMilestones(Long timelineId) {
        log.info("Listing milestones: timelineId={}", timelineId);

        timelineRepository.findByIdAndNotDeleted(timelineId)
                .orElseThrow(() -> ResourceNotFoundException.timelineNotFound(timelineId));

        return milestoneRepository.findAllByTimelineIdOrdered(timelineId).stream()
                .map(milestoneMapper::toResponse)
                .toList();
    }

    /**
     * Merge the fields present in the request over the entity.
     * details is deep-merged; endDate follows a duration change from the existing startDate.
     */
    private void applyChanges(Milestone milestone, UpdateMilestoneRequest request) {
        if (request.getName() != null) {
            milestone.setName(request.getName());
        }
        if (request.getDescription() != null) {
            milestone.setDescription(request.getDescription());
        }
        if (request.getStatus() != null) {
            milestone.setStatus(request.getStatus());
        }
        if (request.getType() != null) {
            milestone.setType(request.getType());
        }
        if (request.getPlannedText() != null) {
            milestone.setPlannedText(request.getPlannedText());
        }
        if (request.getActiveText() != null) {
            milestone.setActiveText(request.getActiveText());
        }
        if (request.getCompletedText() != null) {
            milestone.setCompletedText(request.getCompletedText());
        }
        if (request.getBlockedText() != null) {
            milestone.setBlockedText(request.getBlockedText());
        }
        if (request.getHidden() != null) {
            milestone.setHidden(request.getHidden());
        }
        if (request.getSortOrder() != null) {
            milestone.setSortOrder(request.getSortOrder());
        }
        if (request.isCompletionDateSet()) {
            milestone.setCompletionDate(request.getCompletionDate());
        }

        milestone.setDetails(JsonObjects.merge(milestone.getDetails(), request.getDetails()));

        if (request.getDuration() != null && !request.getDuration().equals(milestone.getDuration())) {
            milestone.setDuration(request.getDuration());
            milestone.setEndDate(Milestone.endDateFor(milestone.getStartDate(), request.getDuration()));
        }
    }
}
