package com.silentrisk.api.controller;

import com.silentrisk.api.dto.StrategyValidationRequest;
import com.silentrisk.api.dto.TaskResponse;
import com.silentrisk.api.service.StrategyValidationService;
import com.silentrisk.api.service.TaskStatusService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/strategy")
@RequiredArgsConstructor
@Tag(name = "Strategy Validation", description = "Validate trading strategy parameters against wallet behaviour")
public class StrategyValidationController {

    private final StrategyValidationService strategyValidationService;
    private final TaskStatusService taskStatusService;

    @PostMapping("/validate")
    @Operation(summary = "Submit a strategy for validation")
    public ResponseEntity<TaskResponse> validate(@Valid @RequestBody StrategyValidationRequest request) {
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(strategyValidationService.submit(request));
    }

    @GetMapping("/status/{taskId}")
    @Operation(summary = "Poll the status of a strategy validation task")
    public ResponseEntity<TaskResponse> getStatus(@PathVariable("taskId") String taskId) {
        return ResponseEntity.ok(taskStatusService.getStatus(taskId));
    }
}
