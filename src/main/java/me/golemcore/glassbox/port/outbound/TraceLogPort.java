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

import me.golemcore.glassbox.domain.model.TraceEvent;

import java.util.List;

/**
 * Append-only event log per execution.
 */
public interface TraceLogPort {

    /**
     * Appends the event and assigns the next sequence number of its execution.
     *
     * @return the stored event
     */
    TraceEvent append(TraceEvent event);

    /**
     * Events of the execution ordered by sequence number.
     */
    List<TraceEvent> list(String executionId);

    /**
     * Frees any per-execution state held for appending. Later appends still
     * continue the sequence.
     */
    void release(String executionId);
}
