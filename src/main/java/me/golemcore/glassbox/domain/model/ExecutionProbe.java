package me.golemcore.glassbox.domain.model;

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

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of polling an execution between iterations: the control signal and any
 * human response waiting in the stored checkpoint.
 */
public record ExecutionProbe(ControlSignal signal, JsonNode humanInputResponse) {

    public static ExecutionProbe cancelled() {
        return new ExecutionProbe(ControlSignal.CANCEL, null);
    }

    public boolean hasHumanInputResponse() {
        return humanInputResponse != null && !humanInputResponse.isNull() && !humanInputResponse.isMissingNode();
    }
}
