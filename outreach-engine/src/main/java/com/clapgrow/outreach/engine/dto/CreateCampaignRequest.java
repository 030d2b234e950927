package com.clapgrow.outreach.engine.dto;

import com.clapgrow.outreach.engine.entity.Campaign;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.Data;

@Data
public class CreateCampaignRequest {
    @NotNull(message = "Sending account is required")
    private Long sendingAccountId;

    @NotBlank(message = "Name is required")
    @Size(max = 255, message = "Name must be at most 255 characters")
    private String name;

    private String description;

    @NotBlank(message = "Message template is required")
    @Size(min = 10, max = 10000, message = "Message template must be between 10 and 10000 characters")
    private String messageTemplate;

    private Boolean personalizationEnabled = true;

    @Min(value = 1, message = "Daily limit must be at least 1")
    @Max(value = 1000, message = "Daily limit must be at most 1000")
    private Integer dailyLimit = Campaign.DEFAULT_DAILY_LIMIT;

    @Min(value = 0, message = "Minimum delay cannot be negative")
    private Integer delayMinSeconds = Campaign.DEFAULT_DELAY_MIN_SECONDS;

    @Min(value = 0, message = "Maximum delay cannot be negative")
    private Integer delayMaxSeconds = Campaign.DEFAULT_DELAY_MAX_SECONDS;
}
