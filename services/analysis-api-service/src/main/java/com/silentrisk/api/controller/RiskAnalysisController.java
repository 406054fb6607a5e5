package com.silentrisk.api.controller;

import com.silentrisk.api.dto.RiskAnalysisRequest;
import com.silentrisk.api.dto.SigningMessageResponse;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.api.service.RiskAnalysisService;
import com.silentrisk.api.service.TaskStatusService;
import com.silentrisk.common.config.SilentRiskProperties;
import com.silentrisk.common.security.OwnershipVerifier;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Pattern;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;

@RestController
@RequestMapping("/api/v1/risk")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Risk Analysis", description = "Privacy-preserving wallet risk assessment")
public class RiskAnalysisController {

    private final RiskAnalysisService riskAnalysisService;
    private final TaskStatusService taskStatusService;
    private final OwnershipVerifier ownershipVerifier;
    private final SilentRiskProperties properties;
    private final Clock clock;

    @PostMapping("/analyze")
    @Operation(summary = "Submit a wallet for risk analysis",
            description = "Returns 202 with a task id, or the cached assessment under task id 'cached'")
    public ResponseEntity<TaskResponse> analyze(@Valid @RequestBody RiskAnalysisRequest request) {
        TaskResponse response = riskAnalysisService.submit(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }

    @GetMapping("/status/{taskId}")
    @Operation(summary = "Poll the status of a risk analysis task")
    public ResponseEntity<TaskResponse> getStatus(@PathVariable("taskId") String taskId) {
        return ResponseEntity.ok(taskStatusService.getStatus(taskId));
    }

    @GetMapping("/message")
    @Operation(summary = "Get the message a wallet must sign to request an analysis")
    public ResponseEntity<SigningMessageResponse> getSigningMessage(
            @RequestParam("walletAddress")
            @Pattern(regexp = "^0x[a-fA-F0-9]{40}$", message = "must be a 0x-prefixed 20-byte hex address")
            String walletAddress,
            @RequestParam(value = "timestamp", required = false) Long timestamp) {

        long effectiveTimestamp = timestamp != null ? timestamp : clock.instant().getEpochSecond();
        return ResponseEntity.ok(SigningMessageResponse.builder()
                .message(ownershipVerifier.expectedMessage(walletAddress, effectiveTimestamp))
                .timestamp(effectiveTimestamp)
                .validForSeconds(properties.getOwnership().getMaxAge().getSeconds())
                .build());
    }
}
