package com.clapgrow.outreach.engine.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.Data;

/**
 * Partial update; null fields are left unchanged.
 */
@Data
public class UpdateCampaignRequest {
    @Size(min = 1, max = 255, message = "Name must be between 1 and 255 characters")
    private String name;

    private String description;

    @Size(min = 10, max = 10000, message = "Message template must be between 10 and 10000 characters")
    private String messageTemplate;

    private Boolean personalizationEnabled;

    @Min(value = 1, message = "Daily limit must be at least 1")
    @Max(value = 1000, message = "Daily limit must be at most 1000")
    private Integer dailyLimit;

    @Min(value = 0, message = "Minimum delay cannot be negative")
    private Integer delayMinSeconds;

    @Min(value = 0, message = "Maximum delay cannot be negative")
    private Integer delayMaxSeconds;
}
