package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.delivery.DeliveryChannelClient;
import com.clapgrow.outreach.common.delivery.DeliveryException;
import com.clapgrow.outreach.common.delivery.DeliveryReceipt;
import com.clapgrow.outreach.common.delivery.DeliveryRequest;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.model.DeliveryChannelResponse;
import com.clapgrow.outreach.engine.repository.SendingAccountRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.Exceptions;

import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link DeliveryChannelClient} for the HTTP messaging gateway.
 *
 * POST {base-url}/messages with {accountId, recipientId, text}; the gateway answers with
 * {messageId}. HTTP errors keep their status and body so FailureClassifier can read them;
 * timeouts and I/O errors carry neither.
 */
@Component
@Slf4j
public class HttpDeliveryChannelClient implements DeliveryChannelClient {

    private final WebClient webClient;
    private final SendingAccountRepository sendingAccountRepository;
    private final Duration timeout;

    public HttpDeliveryChannelClient(WebClient deliveryWebClient,
                                     SendingAccountRepository sendingAccountRepository,
                                     @Value("${outreach.delivery.timeout-seconds:30}") long timeoutSeconds) {
        this.webClient = deliveryWebClient;
        this.sendingAccountRepository = sendingAccountRepository;
        this.timeout = Duration.ofSeconds(timeoutSeconds);
    }

    @Override
    public DeliveryReceipt send(DeliveryRequest request) {
        try {
            DeliveryChannelResponse response = webClient.post()
                .uri("/messages")
                .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .bodyValue(request)
                .retrieve()
                .bodyToMono(DeliveryChannelResponse.class)
                .timeout(timeout)
                .block();

            if (response == null) {
                log.warn("Delivery gateway returned an empty body for recipient {}", request.recipientId());
                return DeliveryReceipt.of(null);
            }
            return new DeliveryReceipt(response.getMessageId(), response.getDeliveredAt());

        } catch (WebClientResponseException e) {
            int status = e.getStatusCode().value();
            throw new DeliveryException("Delivery gateway returned HTTP " + status + ": " + e.getStatusText(),
                status, e.getResponseBodyAsString(), e);
        } catch (WebClientRequestException e) {
            throw new DeliveryException("Delivery gateway unreachable: " + e.getMessage(), null, null, e);
        } catch (RuntimeException e) {
            Throwable cause = Exceptions.unwrap(e);
            if (cause instanceof TimeoutException) {
                throw new DeliveryException("Delivery gateway timed out after " + timeout.getSeconds() + "s",
                    null, null, e);
            }
            throw new DeliveryException("Delivery failed: " + e.getMessage(), null, null, e);
        }
    }

    @Override
    public boolean isAuthenticated(String accountId) {
        try {
            return sendingAccountRepository.findById(Long.valueOf(accountId))
                .map(SendingAccount::isChannelConnected)
                .orElse(false);
        } catch (NumberFormatException e) {
            log.warn("Unexpected sending account id format: {}", accountId);
            return false;
        }
    }
}
