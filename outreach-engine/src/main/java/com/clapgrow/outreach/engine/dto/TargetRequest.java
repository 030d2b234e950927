package com.clapgrow.outreach.engine.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class TargetRequest {
    @NotBlank(message = "Username is required")
    @Size(max = 100, message = "Username must be at most 100 characters")
    private String username;

    private String recipientId;
    private String displayName;

    @Min(value = 0, message = "Follower count cannot be negative")
    private Integer followerCount;

    @Min(value = 0, message = "Following count cannot be negative")
    private Integer followingCount;

    private Boolean dmEligible = true;
}
