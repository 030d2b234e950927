package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.delivery.DeliveryChannelClient;
import com.clapgrow.outreach.common.delivery.DeliveryException;
import com.clapgrow.outreach.common.delivery.DeliveryReceipt;
import com.clapgrow.outreach.common.delivery.DeliveryRequest;
import com.clapgrow.outreach.common.retry.AttemptResult;
import com.clapgrow.outreach.common.retry.FailureClassification;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Single delivery attempt against the channel client, with the outcome turned into a
 * classified {@link AttemptResult}. Nothing thrown by the client escapes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class DeliveryGateway {

    private final DeliveryChannelClient deliveryChannelClient;
    private final FailureClassifier failureClassifier;

    public AttemptResult<DeliveryReceipt> send(DeliveryRequest request) {
        try {
            DeliveryReceipt receipt = deliveryChannelClient.send(request);
            return AttemptResult.success(receipt);
        } catch (DeliveryException e) {
            FailureClassification classification = failureClassifier.classify(
                e.getHttpStatusCode(), e.getMessage(), e.getResponseBody());
            log.debug("Delivery to {} failed ({}): {}", request.recipientId(), classification, e.getMessage());
            return AttemptResult.failure(describe(e), classification);
        } catch (RuntimeException e) {
            FailureClassification classification = failureClassifier.classify(null, e.getMessage(), null);
            log.warn("Unexpected error from delivery client for {}: {}", request.recipientId(), e.toString());
            return AttemptResult.failure(describe(e), classification);
        }
    }

    public boolean isAuthenticated(String accountId) {
        return deliveryChannelClient.isAuthenticated(accountId);
    }

    private static String describe(RuntimeException e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
