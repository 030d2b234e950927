package com.clapgrow.outreach.engine.integration;

import com.clapgrow.outreach.common.delivery.DeliveryChannelClient;
import com.clapgrow.outreach.common.delivery.DeliveryException;
import com.clapgrow.outreach.common.delivery.DeliveryReceipt;
import com.clapgrow.outreach.common.delivery.DeliveryRequest;
import com.clapgrow.outreach.engine.entity.Campaign;
import com.clapgrow.outreach.engine.entity.SendingAccount;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.enums.SendRecordStatus;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.repository.CampaignRepository;
import com.clapgrow.outreach.engine.repository.CampaignTargetRepository;
import com.clapgrow.outreach.engine.repository.SendRecordRepository;
import com.clapgrow.outreach.engine.repository.SendingAccountRepository;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Full campaign lifecycle over HTTP, PostgreSQL and Kafka, with the delivery channel mocked.
 */
@AutoConfigureMockMvc
@DisplayName("Campaign Run Integration Tests")
class CampaignRunIT extends BaseIntegrationTest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private SendingAccountRepository sendingAccountRepository;

    @Autowired
    private CampaignRepository campaignRepository;

    @Autowired
    private CampaignTargetRepository targetRepository;

    @Autowired
    private SendRecordRepository sendRecordRepository;

    @MockBean
    private DeliveryChannelClient deliveryChannelClient;

    private SendingAccount account;

    @BeforeEach
    void setUp() {
        sendRecordRepository.deleteAll();
        targetRepository.deleteAll();
        campaignRepository.deleteAll();
        sendingAccountRepository.deleteAll();

        account = new SendingAccount();
        account.setHandle("brand-" + System.nanoTime());
        account.setDisplayName("Brand");
        account.setChannelConnected(true);
        account = sendingAccountRepository.save(account);

        when(deliveryChannelClient.isAuthenticated(anyString())).thenReturn(true);
        when(deliveryChannelClient.send(any())).thenAnswer(inv -> {
            DeliveryRequest request = inv.getArgument(0);
            if ("ghost".equals(request.recipientId())) {
                throw new DeliveryException("User not found", 404, "{\"error\":\"user_not_found\"}");
            }
            return DeliveryReceipt.of("msg-" + request.recipientId());
        });
    }

    @Test
    @DisplayName("Should run a campaign synchronously and persist every outcome")
    void testSynchronousRun() throws Exception {
        long campaignId = createCampaignWithTargets("alice", "bob", "ghost");

        mockMvc.perform(post("/api/v1/campaigns/{id}/run", campaignId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.sentCount").value(2))
            .andExpect(jsonPath("$.data.failedCount").value(1))
            .andExpect(jsonPath("$.data.errors[0].username").value("ghost"))
            .andExpect(jsonPath("$.data.errors[0].classification").value("PERMANENT"));

        Campaign campaign = campaignRepository.findById(campaignId).orElseThrow();
        assertEquals(CampaignStatus.COMPLETED, campaign.getStatus());
        assertEquals(2, campaign.getMessagesSent());
        assertEquals(3, sendRecordRepository.countByCampaignId(campaignId));
        assertEquals(1, sendRecordRepository.countByCampaignIdAndStatus(campaignId, SendRecordStatus.FAILED));
        assertEquals(1, targetRepository
            .findByCampaignIdAndStatusOrderByCreatedAtAscIdAsc(campaignId, TargetStatus.FAILED).size());

        mockMvc.perform(get("/api/v1/campaigns/{id}/statistics", campaignId))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.successfulSends").value(2))
            .andExpect(jsonPath("$.data.deliveryRate").value(closeTo(66.67, 0.001)));

        mockMvc.perform(get("/api/v1/campaigns/{id}/progress", campaignId))
            .andExpect(status().isNotFound());
    }

    @Test
    @DisplayName("Should retry failed targets of a finished campaign")
    void testRetryFailedReopensCampaign() throws Exception {
        long campaignId = createCampaignWithTargets("alice", "ghost");
        mockMvc.perform(post("/api/v1/campaigns/{id}/run", campaignId)).andExpect(status().isOk());
        assertEquals(CampaignStatus.COMPLETED, campaignRepository.findById(campaignId).orElseThrow().getStatus());

        when(deliveryChannelClient.send(any())).thenReturn(DeliveryReceipt.of("msg-retry"));

        mockMvc.perform(post("/api/v1/campaigns/{id}/retry-failed", campaignId)
                .contentType(MediaType.APPLICATION_JSON)
                .content("{}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.sentCount").value(1));

        Campaign campaign = campaignRepository.findById(campaignId).orElseThrow();
        assertEquals(CampaignStatus.COMPLETED, campaign.getStatus());
        assertEquals(2, campaign.getMessagesSent());
        assertEquals(3, sendRecordRepository.countByCampaignId(campaignId));
    }

    @Test
    @DisplayName("Should run a queued campaign from Kafka")
    void testAsynchronousRun() throws Exception {
        long campaignId = createCampaignWithTargets("alice", "bob");

        mockMvc.perform(post("/api/v1/campaigns/{id}/run/async", campaignId))
            .andExpect(status().isAccepted());

        Instant deadline = Instant.now().plus(Duration.ofSeconds(60));
        CampaignStatus status = CampaignStatus.DRAFT;
        while (Instant.now().isBefore(deadline)) {
            status = campaignRepository.findStatusById(campaignId).orElseThrow();
            if (status == CampaignStatus.COMPLETED) {
                break;
            }
            Thread.sleep(250);
        }
        assertEquals(CampaignStatus.COMPLETED, status);
        assertEquals(2, sendRecordRepository.countByCampaignIdAndStatus(campaignId, SendRecordStatus.SENT));
    }

    @Test
    @DisplayName("Should reject a run when the sending account is disconnected")
    void testRunWithDisconnectedAccount() throws Exception {
        long campaignId = createCampaignWithTargets("alice");
        account.setChannelConnected(false);
        sendingAccountRepository.save(account);

        mockMvc.perform(post("/api/v1/campaigns/{id}/run", campaignId))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("SENDING_IDENTITY_UNAVAILABLE"));

        assertEquals(CampaignStatus.DRAFT, campaignRepository.findById(campaignId).orElseThrow().getStatus());
        verify(deliveryChannelClient, never()).send(any());
    }

    private long createCampaignWithTargets(String... usernames) throws Exception {
        String body = objectMapper.writeValueAsString(Map.of(
            "sendingAccountId", account.getId(),
            "name", "Integration campaign",
            "messageTemplate", "Hi {name}, thanks for following!",
            "delayMinSeconds", 0,
            "delayMaxSeconds", 0));

        String response = mockMvc.perform(post("/api/v1/campaigns")
                .contentType(MediaType.APPLICATION_JSON)
                .content(body))
            .andExpect(status().isCreated())
            .andExpect(jsonPath("$.data.status").value("DRAFT"))
            .andReturn().getResponse().getContentAsString();
        JsonNode created = objectMapper.readTree(response);
        long campaignId = created.path("data").path("id").asLong();

        StringBuilder targets = new StringBuilder("{\"targets\":[");
        for (int i = 0; i < usernames.length; i++) {
            if (i > 0) {
                targets.append(',');
            }
            targets.append("{\"username\":\"").append(usernames[i]).append("\"}");
        }
        targets.append("]}");

        mockMvc.perform(post("/api/v1/campaigns/{id}/targets", campaignId)
                .contentType(MediaType.APPLICATION_JSON)
                .content(targets.toString()))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.data.added").value(usernames.length))
            .andExpect(jsonPath("$.data.totalTargets").value(greaterThanOrEqualTo(usernames.length)));
        return campaignId;
    }
}
