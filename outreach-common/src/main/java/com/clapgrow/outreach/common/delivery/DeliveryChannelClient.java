package com.clapgrow.outreach.common.delivery;

/**
 * Delivery channel interface.
 *
 * Abstraction for the component that actually transmits a direct message for a sending
 * identity. The engine knows nothing about the wire protocol behind {@link #send}.
 *
 * Implementation guidelines:
 * - Throw {@link DeliveryException} on failure, with the HTTP status and response body when
 *   the channel is HTTP based; the engine classifies the error from those details
 * - Never log credentials or sensitive data
 *
 * Example usage:
 * <pre>
 * DeliveryReceipt receipt = client.send(new DeliveryRequest(accountId, recipientId, text));
 * log.info("Delivered as {}", receipt.messageId());
 * </pre>
 */
public interface DeliveryChannelClient {

    /**
     * Send one message.
     *
     * @param request sending identity, recipient and rendered text
     * @return receipt carrying the channel's message id
     * @throws DeliveryException if the channel rejected or failed to deliver the message
     */
    DeliveryReceipt send(DeliveryRequest request) throws DeliveryException;

    /**
     * Check if the sending identity holds a usable, authenticated channel connection.
     *
     * @param accountId sending identity
     * @return true if messages can be sent for the identity
     */
    default boolean isAuthenticated(String accountId) {
        return true;
    }
}
