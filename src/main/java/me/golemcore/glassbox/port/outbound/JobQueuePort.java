package me.golemcore.glassbox.port.outbound;

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

import me.golemcore.glassbox.domain.model.AgentJob;

import java.util.List;

/**
 * At-least-once job transport. Received jobs that are not acknowledged become
 * visible again after the visibility timeout.
 */
public interface JobQueuePort {

    void send(AgentJob job);

    List<ReceivedJob> receive(int maxJobs);

    void ack(String receiptHandle);

    /**
     * A delivered job and the handle that acknowledges it. {@code job} is
     * {@code null} when the payload could not be decoded.
     */
    record ReceivedJob(AgentJob job, String receiptHandle, String rawBody) {
    }
}
