package com.clapgrow.outreach.engine.controller;

import com.clapgrow.outreach.engine.dto.ApiResponse;
import com.clapgrow.outreach.engine.dto.RetryFailedRequest;
import com.clapgrow.outreach.engine.model.ProgressSnapshot;
import com.clapgrow.outreach.engine.model.RunResult;
import com.clapgrow.outreach.engine.service.CampaignRunService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/campaigns")
@RequiredArgsConstructor
@Tag(name = "Campaign runs", description = "Start, pause, retry and observe bulk send runs")
public class CampaignRunController {

    private static final String DEFAULT_REQUESTER = "api";

    private final CampaignRunService campaignRunService;

    @PostMapping("/{id}/run")
    @Operation(summary = "Run a campaign",
        description = "Runs the send loop on the request thread and returns when it stops")
    @ApiResponses(value = {
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "200",
                description = "Run finished; see stopReason"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "409",
                description = "Campaign state forbids a run, or the sending account is busy"),
            @io.swagger.v3.oas.annotations.responses.ApiResponse(responseCode = "422",
                description = "No eligible targets, or the sending account cannot send")
    })
    public ResponseEntity<ApiResponse<RunResult>> run(@PathVariable("id") Long id) {
        return ResponseEntity.ok(ApiResponse.success(campaignRunService.startRun(id)));
    }

    @PostMapping("/{id}/run/async")
    @Operation(summary = "Queue a campaign run", description = "Publishes a run request to Kafka and returns 202")
    public ResponseEntity<ApiResponse<Map<String, Object>>> runAsync(
            @PathVariable("id") Long id,
            @Parameter(description = "Who asked for the run, for the logs")
            @RequestHeader(name = "X-Requested-By", required = false) String requestedBy) {
        campaignRunService.requestRun(id, false, null, requester(requestedBy));
        return ResponseEntity.status(HttpStatus.ACCEPTED)
            .body(ApiResponse.success(Map.of("campaignId", id, "status", "QUEUED")));
    }

    @PostMapping("/{id}/pause")
    @Operation(summary = "Pause a campaign", description = "A running send loop stops before its next target")
    public ResponseEntity<ApiResponse<Map<String, Object>>> pause(@PathVariable("id") Long id) {
        boolean paused = campaignRunService.pause(id);
        return ResponseEntity.ok(ApiResponse.success(Map.of("campaignId", id, "paused", paused)));
    }

    @GetMapping("/{id}/progress")
    @Operation(summary = "Live run progress", description = "404 when no run is in progress")
    public ResponseEntity<ApiResponse<ProgressSnapshot>> progress(@PathVariable("id") Long id) {
        return campaignRunService.getProgress(id)
            .map(snapshot -> ResponseEntity.ok(ApiResponse.success(snapshot)))
            .orElseGet(() -> ResponseEntity.status(HttpStatus.NOT_FOUND)
                .body(ApiResponse.error("No run in progress for campaign " + id)));
    }

    @PostMapping("/{id}/retry-failed")
    @Operation(summary = "Retry failed targets",
        description = "Resets failed targets (all, or the listed ones) to PENDING and runs the campaign")
    public ResponseEntity<ApiResponse<RunResult>> retryFailed(
            @PathVariable("id") Long id,
            @RequestBody(required = false) RetryFailedRequest request) {
        List<Long> targetIds = request != null ? request.getTargetIds() : null;
        return ResponseEntity.ok(ApiResponse.success(campaignRunService.retryFailed(id, targetIds)));
    }

    private static String requester(String requestedBy) {
        return requestedBy == null || requestedBy.isBlank() ? DEFAULT_REQUESTER : requestedBy;
    }
}
