package com.clapgrow.outreach.engine.controller;

import com.clapgrow.outreach.engine.dto.AddTargetsRequest;
import com.clapgrow.outreach.engine.dto.AddTargetsResponse;
import com.clapgrow.outreach.engine.dto.ApiResponse;
import com.clapgrow.outreach.engine.dto.CampaignResponse;
import com.clapgrow.outreach.engine.dto.CampaignStatisticsResponse;
import com.clapgrow.outreach.engine.dto.CreateCampaignRequest;
import com.clapgrow.outreach.engine.dto.TargetResponse;
import com.clapgrow.outreach.engine.dto.UpdateCampaignRequest;
import com.clapgrow.outreach.engine.enums.CampaignStatus;
import com.clapgrow.outreach.engine.enums.TargetStatus;
import com.clapgrow.outreach.engine.service.CampaignService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
@Tag(name = "Campaigns", description = "Create campaigns, manage their targets and read their statistics")
public class CampaignController {

    private final CampaignService campaignService;

    @PostMapping
    @Operation(summary = "Create a campaign", description = "Creates a campaign in DRAFT status")
    public ResponseEntity<ApiResponse<CampaignResponse>> createCampaign(
            @Valid @RequestBody CreateCampaignRequest request) {
        CampaignResponse created = CampaignResponse.from(campaignService.createCampaign(request));
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(created));
    }

    @GetMapping
    @Operation(summary = "List campaigns", description = "Newest first, optionally filtered by sending account and status")
    public ResponseEntity<ApiResponse<List<CampaignResponse>>> listCampaigns(
            @Parameter(description = "Sending account id")
            @RequestParam(name = "accountId", required = false) Long accountId,
            @Parameter(description = "Campaign status")
            @RequestParam(name = "status", required = false) CampaignStatus status) {
        List<CampaignResponse> campaigns = campaignService.listCampaigns(accountId, status).stream()
            .map(CampaignResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.success(campaigns));
    }

    @GetMapping("/{id}")
    @Operation(summary = "Get a campaign")
    public ResponseEntity<ApiResponse<CampaignResponse>> getCampaign(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiResponse.success(CampaignResponse.from(campaignService.getCampaign(id))));
    }

    @PutMapping("/{id}")
    @Operation(summary = "Update a campaign",
        description = "Template, delays and personalization can only change while the campaign is a DRAFT")
    public ResponseEntity<ApiResponse<CampaignResponse>> updateCampaign(
            @PathVariable("id") Long id,
            @Valid @RequestBody UpdateCampaignRequest request) {
        return ResponseEntity.ok(ApiResponse.success(
            CampaignResponse.from(campaignService.updateCampaign(id, request))));
    }

    @DeleteMapping("/{id}")
    @Operation(summary = "Delete a campaign", description = "Refused while the campaign is ACTIVE")
    public ResponseEntity<ApiResponse<Void>> deleteCampaign(@PathVariable("id") Long id) {
        campaignService.deleteCampaign(id);
        return ResponseEntity.ok(ApiResponse.successEmpty());
    }

    @PostMapping("/{id}/targets")
    @Operation(summary = "Add targets", description = "DRAFT or PAUSED campaigns only; duplicate handles are skipped")
    public ResponseEntity<ApiResponse<AddTargetsResponse>> addTargets(
            @PathVariable("id") Long id,
            @Valid @RequestBody AddTargetsRequest request) {
        return ResponseEntity.ok(ApiResponse.success(campaignService.addTargets(id, request.getTargets())));
    }

    @GetMapping("/{id}/targets")
    @Operation(summary = "List targets", description = "In creation order, optionally filtered by status")
    public ResponseEntity<ApiResponse<List<TargetResponse>>> listTargets(
            @PathVariable("id") Long id,
            @RequestParam(name = "status", required = false) TargetStatus status) {
        List<TargetResponse> targets = campaignService.listTargets(id, status).stream()
            .map(TargetResponse::from)
            .toList();
        return ResponseEntity.ok(ApiResponse.success(targets));
    }

    @PostMapping("/{id}/activate")
    @Operation(summary = "Activate a campaign", description = "Moves a DRAFT campaign to ACTIVE without starting a run")
    public ResponseEntity<ApiResponse<CampaignResponse>> activateCampaign(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiResponse.success(CampaignResponse.from(campaignService.activateCampaign(id))));
    }

    @PostMapping("/{id}/targets/{targetId}/reply")
    @Operation(summary = "Record a reply", description = "Marks a SENT target as REPLIED")
    public ResponseEntity<ApiResponse<TargetResponse>> recordReply(
            @PathVariable("id") Long id,
            @PathVariable("targetId") Long targetId) {
        return ResponseEntity.ok(ApiResponse.success(TargetResponse.from(campaignService.recordReply(id, targetId))));
    }

    @GetMapping("/{id}/statistics")
    @Operation(summary = "Campaign statistics")
    public ResponseEntity<ApiResponse<CampaignStatisticsResponse>> getStatistics(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiResponse.success(campaignService.getStatistics(id)));
    }
}
