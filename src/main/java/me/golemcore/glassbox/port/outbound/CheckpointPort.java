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

import me.golemcore.glassbox.domain.model.StoredCheckpoint;
import me.golemcore.glassbox.domain.model.TokenTotals;

/**
 * Durable load/save of the serialized agent state and token counters. Each call
 * is atomic per execution id.
 */
public interface CheckpointPort {

    void save(String executionId, String serializedState, TokenTotals tokens);

    StoredCheckpoint load(String executionId);
}
