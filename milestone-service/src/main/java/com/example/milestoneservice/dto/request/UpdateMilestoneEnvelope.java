package com.example.milestoneservice.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Wire envelope for PATCH bodies: {"param": {...}}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class UpdateMilestoneEnvelope {

    @NotNull(message = "param is required")
    @Valid
    private UpdateMilestoneRequest param;
}
