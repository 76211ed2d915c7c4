package com.example.milestoneservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource not found errors (HTTP 404).
 */
public class ResourceNotFoundException extends BaseException {

    public ResourceNotFoundException(String code, String message) {
        super(code, message, HttpStatus.NOT_FOUND);
    }

    public static ResourceNotFoundException timelineNotFound(Long timelineId) {
        return new ResourceNotFoundException(
            "TIMELINE_NOT_FOUND",
            String.format("Timeline not found for timeline id %d", timelineId)
        );
    }

    /**
     * Milestone not found under the given timeline.
     */
    public static ResourceNotFoundException milestoneNotFound(Long milestoneId) {
        return new ResourceNotFoundException(
            "MILESTONE_NOT_FOUND",
            String.format("Milestone not found for milestone id %d", milestoneId)
        );
    }
}
