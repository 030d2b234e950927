package com.clapgrow.outreach.common.delivery;

/**
 * One message to deliver.
 *
 * @param accountId   sending identity
 * @param recipientId channel-level recipient identifier
 * @param text        rendered message body
 */
public record DeliveryRequest(String accountId, String recipientId, String text) {
}
