package com.example.milestoneservice.service;

/**
 * A single-slot order adjustment on a sibling displaced by a move.
 */
public record OrderShift(Long milestoneId, int oldOrder, int newOrder) {
}
