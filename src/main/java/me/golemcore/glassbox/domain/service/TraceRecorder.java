package me.golemcore.glassbox.domain.service;

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
import me.golemcore.glassbox.domain.model.TraceEvent;
import me.golemcore.glassbox.domain.model.TraceEventType;
import me.golemcore.glassbox.port.outbound.TraceLogPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds trace events and appends them to the trace log.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TraceRecorder {

    private final TraceLogPort traceLogPort;

    public TraceEvent record(String executionId, TraceEventType type, Map<String, Object> payload) {
        return traceLogPort.append(TraceEvent.builder()
                .executionId(executionId)
                .type(type)
                .payload(copy(payload))
                .build());
    }

    public TraceEvent recordLlmCall(String executionId, String model, long durationMs, int tokensIn,
            int tokensOut) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("model", model);
        payload.put("tokens_in", tokensIn);
        payload.put("tokens_out", tokensOut);
        return traceLogPort.append(TraceEvent.builder()
                .executionId(executionId)
                .type(TraceEventType.LLM_CALL)
                .payload(payload)
                .durationMs(durationMs)
                .model(model)
                .tokensIn(tokensIn)
                .tokensOut(tokensOut)
                .build());
    }

    /**
     * Records an error without letting a trace failure replace the original
     * fault.
     */
    public void recordErrorSafely(String executionId, String message) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("message", message);
        try {
            record(executionId, TraceEventType.ERROR, payload);
        } catch (RuntimeException e) {
            log.error("[Engine] Failed to record error event for {}: {}", executionId, e.getMessage(), e);
        }
    }

    public void release(String executionId) {
        traceLogPort.release(executionId);
    }

    private Map<String, Object> copy(Map<String, Object> payload) {
        return payload != null ? new LinkedHashMap<>(payload) : new LinkedHashMap<>();
    }
}
