package com.example.milestoneservice.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Null;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.Map;

/**
 * Request DTO for a partial milestone update.
 * Every field is optional; absent fields keep their current value.
 *
 * Not bindable:
 * - startDate / endDate: derived by the scheduler, rejected when present
 * - id, audit and soft-delete fields: silently ignored (not declared here)
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMilestoneRequest {

    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    @Size(max = 255, message = "Description must be at most 255 characters")
    private String description;

    @Min(value = 1, message = "Duration must be at least 1 day")
    private Integer duration;

    @Null(message = "startDate cannot be set")
    private Object startDate;

    @Null(message = "endDate cannot be set")
    private Object endDate;

    private LocalDate completionDate;

    /**
     * True when the payload carried "completionDate", even as null.
     * An explicit null clears the completion date.
     */
    @JsonIgnore
    private boolean completionDateSet;

    @Size(max = 45, message = "Status must be at most 45 characters")
    private String status;

    @Size(max = 45, message = "Type must be at most 45 characters")
    private String type;

    private Map<String, Object> details;

    @JsonProperty("order")
    @Positive(message = "Order must be a positive integer")
    private Integer sortOrder;

    @Size(max = 512)
    private String plannedText;

    @Size(max = 512)
    private String activeText;

    @Size(max = 512)
    private String completedText;

    @Size(max = 512)
    private String blockedText;

    private Boolean hidden;

    public void setCompletionDate(LocalDate completionDate) {
        this.completionDate = completionDate;
        this.completionDateSet = true;
    }

    public boolean isCompletionDateSet() {
        return completionDateSet || completionDate != null;
    }
}
