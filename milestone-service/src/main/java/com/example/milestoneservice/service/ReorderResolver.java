package com.example.milestoneservice.service;

import com.example.milestoneservice.entity.Milestone;
import com.example.milestoneservice.repository.MilestoneRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Keeps milestone orders dense and unique when one milestone moves.
 *
 * Moving M to K when a sibling already sits at K:
 * - M < K: siblings in (M, K] move down one slot
 * - K < M: siblings in [K, M) move up one slot
 * If K is free, nothing moves and the caller's value stands.
 * The moved milestone itself is never shifted.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReorderResolver {

    private final MilestoneRepository milestoneRepository;

    /**
     * Compute the shifts a move requires. Must run inside the update transaction.
     */
    public List<OrderShift> resolve(Long timelineId, Long milestoneId, int oldOrder, int newOrder) {
        requirePositive(oldOrder, "oldOrder");
        requirePositive(newOrder, "newOrder");

        if (oldOrder == newOrder) {
            return List.of();
        }

        List<Milestone> siblings = milestoneRepository.findSiblingsInOrderRange(
                timelineId, milestoneId, Math.min(oldOrder, newOrder), Math.max(oldOrder, newOrder));

        List<OrderShift> shifts = computeShifts(siblings, milestoneId, oldOrder, newOrder);
        log.debug("Resolved reorder: timelineId={}, milestoneId={}, {} -> {}, shifts={}",
                timelineId, milestoneId, oldOrder, newOrder, shifts.size());
        return shifts;
    }

    /**
     * Apply shifts to the loaded siblings and persist them.
     */
    public void applyShifts(List<OrderShift> shifts) {
        if (shifts.isEmpty()) {
            return;
        }
        Map<Long, OrderShift> byId = shifts.stream()
                .collect(Collectors.toMap(OrderShift::milestoneId, Function.identity()));

        List<Milestone> shifted = milestoneRepository.findAllById(byId.keySet());
        shifted.forEach(m -> m.setSortOrder(byId.get(m.getId()).newOrder()));
        milestoneRepository.saveAllAndFlush(shifted);
    }

    /**
     * Pure shift computation over the siblings of one timeline.
     * Siblings outside the moved interval are ignored, so the full timeline may be passed.
     */
    static List<OrderShift> computeShifts(Collection<Milestone> siblings, Long movedId,
                                          int oldOrder, int newOrder) {
        if (oldOrder == newOrder) {
            return List.of();
        }

        boolean targetOccupied = siblings.stream()
                .filter(m -> !Objects.equals(m.getId(), movedId))
                .anyMatch(m -> m.getSortOrder() == newOrder);
        if (!targetOccupied) {
            return List.of();
        }

        boolean movingUp = oldOrder < newOrder;
        int delta = movingUp ? -1 : 1;

        return siblings.stream()
                .filter(m -> !Objects.equals(m.getId(), movedId))
                .filter(m -> movingUp
                        ? m.getSortOrder() > oldOrder && m.getSortOrder() <= newOrder
                        : m.getSortOrder() >= newOrder && m.getSortOrder() < oldOrder)
                .sorted(Comparator.comparing(Milestone::getSortOrder))
                .map(m -> new OrderShift(m.getId(), m.getSortOrder(), m.getSortOrder() + delta))
                .toList();
    }

    private static void requirePositive(int order, String name) {
        if (order < 1) {
            throw new IllegalArgumentException(name + " must be a positive integer, got " + order);
        }
    }
}
