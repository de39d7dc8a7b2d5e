package me.golemcore.glassbox.adapter.outbound.storage;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.TraceEvent;
import me.golemcore.glassbox.port.outbound.StoragePort;
import me.golemcore.glassbox.port.outbound.TraceLogPort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Trace events appended as JSON lines to {@code trace/<executionId>.jsonl}.
 * Sequence numbers are assigned under a per-execution monitor and continue from
 * the last stored event after a restart or a {@link #release(String)}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StorageTraceLog implements TraceLogPort {

    private static final String TRACE_DIR = "trace";
    private static final String JSONL_EXTENSION = ".jsonl";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private final Map<String, SequenceCounter> counters = new ConcurrentHashMap<>();

    @Override
    public TraceEvent append(TraceEvent event) {
        String executionId = event.getExecutionId();
        while (true) {
            SequenceCounter counter = counters.computeIfAbsent(executionId, id -> new SequenceCounter());
            synchronized (counter) {
                if (counter.released) {
                    continue;
                }
                return appendNext(event, counter);
            }
        }
    }

    /**
     * Drops the in-memory counter of an execution. The next append recovers the
     * sequence from the stored events.
     */
    @Override
    public void release(String executionId) {
        SequenceCounter counter = counters.get(executionId);
        if (counter == null) {
            return;
        }
        synchronized (counter) {
            counters.remove(executionId, counter);
            counter.released = true;
        }
    }

    int counterCount() {
        return counters.size();
    }

    private TraceEvent appendNext(TraceEvent event, SequenceCounter counter) {
        String executionId = event.getExecutionId();
        if (!counter.initialized) {
            counter.last = list(executionId).stream()
                    .mapToLong(TraceEvent::getSequenceNumber)
                    .max()
                    .orElse(0);
            counter.initialized = true;
        }
        TraceEvent stored = event.toBuilder()
                .id(event.getId() != null ? event.getId() : UUID.randomUUID().toString())
                .sequenceNumber(counter.last + 1)
                .timestamp(event.getTimestamp() != null ? event.getTimestamp() : clock.instant())
                .build();
        storagePort.appendText(TRACE_DIR, executionId + JSONL_EXTENSION, toLine(stored)).join();
        counter.last = stored.getSequenceNumber();
        log.debug("[Storage] Trace {} #{} {}", executionId, stored.getSequenceNumber(),
                stored.getType().getValue());
        return stored;
    }

    @Override
    public List<TraceEvent> list(String executionId) {
        String content = storagePort.getText(TRACE_DIR, executionId + JSONL_EXTENSION).join();
        if (content == null || content.isBlank()) {
            return List.of();
        }
        List<TraceEvent> events = new ArrayList<>();
        for (String line : content.split("\n")) {
            if (line.isBlank()) {
                continue;
            }
            try {
                events.add(objectMapper.readValue(line, TraceEvent.class));
            } catch (JsonProcessingException e) {
                log.warn("[Storage] Skipping unreadable trace line for {}: {}", executionId, e.getMessage());
            }
        }
        events.sort(Comparator.comparingLong(TraceEvent::getSequenceNumber));
        return events;
    }

    private String toLine(TraceEvent event) {
        try {
            return objectMapper.writeValueAsString(event) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize trace event for " + event.getExecutionId(), e);
        }
    }

    private static final class SequenceCounter {
        private boolean initialized;
        private boolean released;
        private long last;
    }
}
