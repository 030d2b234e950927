package com.clapgrow.outreach.engine.service;

import com.clapgrow.outreach.common.delivery.DeliveryException;
import com.clapgrow.outreach.common.delivery.DeliveryReceipt;
import com.clapgrow.outreach.common.delivery.DeliveryRequest;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.repository.SendingAccountRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HttpDeliveryChannelClientTest {

    @Mock
    private SendingAccountRepository accountRepository;

    private final DeliveryRequest request = new DeliveryRequest("3", "alice", "Hi alice, welcome aboard");

    @Test
    void testSend_Success_ReadsMessageId() {
        AtomicReference<ClientRequest> captured = new AtomicReference<>();
        HttpDeliveryChannelClient client = client(clientRequest -> {
            captured.set(clientRequest);
            return Mono.just(json(HttpStatus.OK, "{\"messageId\":\"msg-42\",\"extra\":true}"));
        }, 5);

        DeliveryReceipt receipt = client.send(request);

        assertEquals("msg-42", receipt.messageId());
        assertNull(receipt.deliveredAt());
        assertEquals(HttpMethod.POST, captured.get().method());
        assertEquals("http://gateway.test/api/messages", captured.get().url().toString());
    }

    @Test
    void testSend_HttpError_KeepsStatusAndBody() {
        HttpDeliveryChannelClient client = client(
            clientRequest -> Mono.just(json(HttpStatus.TOO_MANY_REQUESTS, "{\"error\":\"slow down\"}")), 5);

        DeliveryException e = assertThrows(DeliveryException.class, () -> client.send(request));

        assertEquals(429, e.getHttpStatusCode());
        assertEquals("{\"error\":\"slow down\"}", e.getResponseBody());
    }

    @Test
    void testSend_Timeout_NoStatus() {
        HttpDeliveryChannelClient client = client(clientRequest -> Mono.never(), 1);

        DeliveryException e = assertThrows(DeliveryException.class, () -> client.send(request));

        assertNull(e.getHttpStatusCode());
        assertNull(e.getResponseBody());
        assertTrue(e.getMessage().contains("timed out"));
    }

    @Test
    void testIsAuthenticated_FollowsChannelConnection() {
        SendingAccount connected = new SendingAccount();
        connected.setChannelConnected(true);
        when(accountRepository.findById(3L)).thenReturn(Optional.of(connected));
        when(accountRepository.findById(4L)).thenReturn(Optional.empty());
        HttpDeliveryChannelClient client = client(clientRequest -> Mono.empty(), 5);

        assertTrue(client.isAuthenticated("3"));
        assertFalse(client.isAuthenticated("4"));
        assertFalse(client.isAuthenticated("not-a-number"));
    }

    private HttpDeliveryChannelClient client(ExchangeFunction exchange, long timeoutSeconds) {
        WebClient webClient = WebClient.builder()
            .baseUrl("http://gateway.test/api")
            .exchangeFunction(exchange)
            .build();
        return new HttpDeliveryChannelClient(webClient, accountRepository, timeoutSeconds);
    }

    private static ClientResponse json(HttpStatus status, String body) {
        return ClientResponse.create(status)
            .header(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .body(body)
            .build();
    }
}
