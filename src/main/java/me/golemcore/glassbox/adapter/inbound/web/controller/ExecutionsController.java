package me.golemcore.glassbox.adapter.inbound.web.controller;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.adapter.inbound.web.dto.ExecutionResponse;
import me.golemcore.glassbox.adapter.inbound.web.dto.HumanInputSubmission;
import me.golemcore.glassbox.adapter.inbound.web.dto.ResumeExecutionRequest;
import me.golemcore.glassbox.adapter.inbound.web.dto.StartExecutionRequest;
import me.golemcore.glassbox.adapter.inbound.web.dto.TraceEventDto;
import me.golemcore.glassbox.domain.model.Execution;
import me.golemcore.glassbox.domain.model.ExecutionView;
import me.golemcore.glassbox.domain.model.TraceEvent;
import me.golemcore.glassbox.domain.service.ExecutionSupervisorService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;

/**
 * Supervisor API: start, pause, resume and cancel executions, answer pending
 * questions and read the trace.
 */
@RestController
@RequestMapping("/api/executions")
@RequiredArgsConstructor
@Slf4j
public class ExecutionsController {

    private final ExecutionSupervisorService supervisorService;

    @PostMapping
    public Mono<ResponseEntity<ExecutionResponse>> start(@RequestBody StartExecutionRequest request) {
        if (request == null || request.getNodeId() == null || request.getNodeId().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "nodeId is required");
        }
        Execution execution = supervisorService.start(request.getNodeId(), request.getOrgConfig());
        return Mono.just(ResponseEntity.status(HttpStatus.CREATED)
                .body(toResponse(supervisorService.get(execution.getId()))));
    }

    @GetMapping("/{executionId}")
    public Mono<ResponseEntity<ExecutionResponse>> get(@PathVariable String executionId) {
        return Mono.just(ResponseEntity.ok(toResponse(supervisorService.get(executionId))));
    }

    @GetMapping
    public Mono<ResponseEntity<ExecutionResponse>> currentForNode(@RequestParam String nodeId) {
        ExecutionView view = supervisorService.currentForNode(nodeId)
                .orElseThrow(() -> new ResponseStatusException(HttpStatus.NOT_FOUND,
                        "No execution for node: " + nodeId));
        return Mono.just(ResponseEntity.ok(toResponse(view)));
    }

    @PostMapping("/{executionId}/pause")
    public Mono<ResponseEntity<ExecutionResponse>> pause(@PathVariable String executionId) {
        supervisorService.pause(executionId);
        return Mono.just(ResponseEntity.ok(toResponse(supervisorService.get(executionId))));
    }

    @PostMapping("/{executionId}/resume")
    public Mono<ResponseEntity<ExecutionResponse>> resume(@PathVariable String executionId,
            @RequestBody(required = false) ResumeExecutionRequest request) {
        supervisorService.resume(executionId, request != null ? request.getOrgConfig() : null);
        return Mono.just(ResponseEntity.ok(toResponse(supervisorService.get(executionId))));
    }

    @PostMapping("/{executionId}/cancel")
    public Mono<ResponseEntity<ExecutionResponse>> cancel(@PathVariable String executionId) {
        supervisorService.cancel(executionId);
        return Mono.just(ResponseEntity.ok(toResponse(supervisorService.get(executionId))));
    }

    @PostMapping("/{executionId}/input")
    public Mono<ResponseEntity<ExecutionResponse>> provideInput(@PathVariable String executionId,
            @RequestBody HumanInputSubmission submission) {
        if (submission == null || submission.getResponse() == null || submission.getResponse().isNull()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "response is required");
        }
        supervisorService.provideInput(executionId, submission.getResponse(), submission.getOrgConfig());
        return Mono.just(ResponseEntity.ok(toResponse(supervisorService.get(executionId))));
    }

    @GetMapping("/{executionId}/trace")
    public Mono<ResponseEntity<List<TraceEventDto>>> trace(@PathVariable String executionId) {
        List<TraceEventDto> events = supervisorService.trace(executionId).stream()
                .map(this::toDto)
                .toList();
        return Mono.just(ResponseEntity.ok(events));
    }

    private ExecutionResponse toResponse(ExecutionView view) {
        Execution execution = view.execution();
        return ExecutionResponse.builder()
                .id(execution.getId())
                .nodeId(execution.getNodeId())
                .status(execution.getStatus() != null ? execution.getStatus().getValue() : null)
                .modelId(execution.getModelId())
                .totalTokensIn(execution.getTotalTokensIn())
                .totalTokensOut(execution.getTotalTokensOut())
                .errorMessage(execution.getErrorMessage())
                .iteration(view.iteration())
                .humanInputRequest(view.humanInputRequest())
                .humanInputResponse(view.humanInputResponse())
                .createdAt(format(execution.getCreatedAt()))
                .startedAt(format(execution.getStartedAt()))
                .completedAt(format(execution.getCompletedAt()))
                .build();
    }

    private TraceEventDto toDto(TraceEvent event) {
        return TraceEventDto.builder()
                .id(event.getId())
                .sequenceNumber(event.getSequenceNumber())
                .eventType(event.getType() != null ? event.getType().getValue() : null)
                .payload(event.getPayload())
                .durationMs(event.getDurationMs())
                .model(event.getModel())
                .tokensIn(event.getTokensIn())
                .tokensOut(event.getTokensOut())
                .timestamp(format(event.getTimestamp()))
                .build();
    }

    private static String format(Instant instant) {
        return instant != null ? instant.toString() : null;
    }
}
