package com.clapgrow.outreach.common.delivery;

import java.time.Instant;

/**
 * Channel acknowledgement of a delivered message.
 *
 * @param messageId   channel message id, may be null if the channel does not return one
 * @param deliveredAt delivery time reported by the channel, may be null
 */
public record DeliveryReceipt(String messageId, Instant deliveredAt) {

    public static DeliveryReceipt of(String messageId) {
        return new DeliveryReceipt(messageId, null);
    }
}
