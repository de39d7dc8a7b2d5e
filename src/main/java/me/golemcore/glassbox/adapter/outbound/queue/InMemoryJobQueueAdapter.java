package me.golemcore.glassbox.adapter.outbound.queue;

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
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.AgentJob;
import me.golemcore.glassbox.infrastructure.config.AgentProperties;
import me.golemcore.glassbox.port.outbound.JobQueuePort;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * In-process job transport with visibility-timeout semantics. A received job
 * stays invisible until it is acknowledged or its timeout expires, after which
 * it is delivered again with a new receipt handle.
 *
 * <p>
 * Payloads are kept as JSON text so that malformed jobs reach the consumer the
 * same way they would from an external queue.
 */
@Component
@Slf4j
public class InMemoryJobQueueAdapter implements JobQueuePort {

    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Duration visibilityTimeout;

    private final Map<String, Entry> entries = new LinkedHashMap<>();

    public InMemoryJobQueueAdapter(ObjectMapper objectMapper, Clock clock, AgentProperties properties) {
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.visibilityTimeout = Duration.ofSeconds(properties.getWorker().getVisibilityTimeoutSeconds());
    }

    @Override
    public void send(AgentJob job) {
        try {
            sendRaw(objectMapper.writeValueAsString(job));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize job for execution " + job.getExecutionId(), e);
        }
        log.debug("[Queue] Enqueued job for execution {}", job.getExecutionId());
    }

    /**
     * Enqueues a raw payload as-is.
     */
    public synchronized void sendRaw(String body) {
        String messageId = UUID.randomUUID().toString();
        entries.put(messageId, new Entry(messageId, body));
    }

    @Override
    public synchronized List<ReceivedJob> receive(int maxJobs) {
        Instant now = clock.instant();
        List<ReceivedJob> received = new ArrayList<>();
        for (Entry entry : entries.values()) {
            if (received.size() >= maxJobs) {
                break;
            }
            if (entry.invisibleUntil != null && now.isBefore(entry.invisibleUntil)) {
                continue;
            }
            if (entry.invisibleUntil != null) {
                log.info("[Queue] Redelivering message {} after visibility timeout", entry.messageId);
            }
            entry.receiptHandle = UUID.randomUUID().toString();
            entry.invisibleUntil = now.plus(visibilityTimeout);
            received.add(new ReceivedJob(decode(entry.body), entry.receiptHandle, entry.body));
        }
        return received;
    }

    @Override
    public synchronized void ack(String receiptHandle) {
        Iterator<Entry> iterator = entries.values().iterator();
        while (iterator.hasNext()) {
            Entry entry = iterator.next();
            if (receiptHandle != null && receiptHandle.equals(entry.receiptHandle)) {
                iterator.remove();
                return;
            }
        }
        log.debug("[Queue] Ack for unknown or expired receipt handle {}", receiptHandle);
    }

    public synchronized int size() {
        return entries.size();
    }

    private AgentJob decode(String body) {
        try {
            return objectMapper.readValue(body, AgentJob.class);
        } catch (JsonProcessingException e) {
            log.warn("[Queue] Undecodable job payload: {}", e.getOriginalMessage());
            return null;
        }
    }

    private static final class Entry {
        private final String messageId;
        private final String body;
        private String receiptHandle;
        private Instant invisibleUntil;

        private Entry(String messageId, String body) {
            this.messageId = messageId;
            this.body = body;
        }
    }
}
