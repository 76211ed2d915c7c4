package com.example.milestoneservice.service;

import com.example.milestoneservice.entity.Milestone;
import com.example.milestoneservice.repository.MilestoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Propagates a changed effective end date to every later milestone of the timeline.
 *
 * Walks the followers in order with a cursor (the day after the previous effective end).
 * A follower whose start already equals the cursor is left untouched, but the walk
 * continues from its own effective end: only rows whose start actually moves are written.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class CascadeScheduler {

    private final MilestoneRepository milestoneRepository;

    /**
     * Reschedule the followers of an already persisted milestone.
     * Must run inside the update transaction.
     *
     * @param updated milestone carrying its final order, duration and dates
     * @return the writes that were persisted, in order
     */
    public List<ScheduleWrite> cascade(Milestone updated) {
        List<Milestone> followers = milestoneRepository.findAllAfterOrder(
                updated.getTimelineId(), updated.getSortOrder());

        List<ScheduleWrite> writes = plan(updated, followers);
        if (writes.isEmpty()) {
            log.debug("Cascade found nothing stale: milestoneId={}", updated.getId());
            return writes;
        }

        Map<Long, Milestone> byId = followers.stream()
                .collect(Collectors.toMap(Milestone::getId, Function.identity()));
        List<Milestone> changed = new ArrayList<>(writes.size());
        for (ScheduleWrite write : writes) {
            Milestone follower = byId.get(write.milestoneId());
            follower.rescheduleFrom(write.startDate());
            changed.add(follower);
        }
        milestoneRepository.saveAllAndFlush(changed);

        log.info("Cascaded schedule: timelineId={}, fromMilestoneId={}, rescheduled={}",
                updated.getTimelineId(), updated.getId(), writes.size());
        return writes;
    }

    /**
     * Pure planning step. Does not modify the given milestones.
     */
    static List<ScheduleWrite> plan(Milestone anchor, Collection<Milestone> followers) {
        List<Milestone> ordered = followers.stream()
                .filter(m -> m.getSortOrder() > anchor.getSortOrder())
                .sorted(Comparator.comparing(Milestone::getSortOrder))
                .toList();

        List<ScheduleWrite> writes = new ArrayList<>();
        LocalDate cursor = anchor.effectiveEndDate().plusDays(1);

        for (Milestone follower : ordered) {
            if (cursor.equals(follower.getStartDate())) {
                cursor = follower.effectiveEndDate().plusDays(1);
                continue;
            }

            LocalDate newStart = cursor;
            LocalDate newEnd = Milestone.endDateFor(newStart, follower.getDuration());
            writes.add(new ScheduleWrite(follower.getId(), newStart, newEnd));

            LocalDate effectiveEnd = follower.getCompletionDate() != null
                    ? follower.getCompletionDate()
                    : newEnd;
            cursor = effectiveEnd.plusDays(1);
        }
        return writes;
    }
}
