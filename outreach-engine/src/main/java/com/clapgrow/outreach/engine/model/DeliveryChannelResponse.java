package com.clapgrow.outreach.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.time.Instant;

@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class DeliveryChannelResponse {
    private String messageId;
    private Instant deliveredAt;
}
