package com.example.common.events;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.Instant;

/**
 * Milestone Updated Event
 *
 * Published by: Milestone Service after an update transaction commits.
 * Topic: milestone.updated
 *
 * Exactly one event is published per update request. Siblings whose order or
 * dates were adjusted by the same request are NOT announced separately:
 * consumers rebuild the timeline from this single event.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MilestoneUpdatedEvent implements Serializable {

    private static final long serialVersionUID = 1L;

    /**
     * State of the targeted milestone before the update
     */
    private MilestoneSnapshot original;

    /**
     * State of the targeted milestone after the update
     */
    private MilestoneSnapshot updated;

    /**
     * X-Request-ID of the HTTP request that caused the update
     */
    private String correlationId;

    /**
     * Event ID (UUID) for consumer-side deduplication
     */
    private String eventId;

    private Instant eventTimestamp;
}
