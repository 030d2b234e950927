package com.clapgrow.outreach.engine.dto;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class AddTargetsRequest {
    @NotEmpty(message = "At least one target is required")
    @Valid
    private List<TargetRequest> targets;
}
