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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of facts recorded in an execution's trace log.
 */
public enum TraceEventType {

    EXECUTION_START,
    EXECUTION_RESUME,
    LLM_CALL,
    TOOL_CALL,
    SUBNODE_CREATED,
    OUTPUT_ADDED,
    HUMAN_INPUT_REQUESTED,
    HUMAN_INPUT_RECEIVED,
    EXECUTION_PAUSED,
    EXECUTION_CANCELLED,
    EXECUTION_COMPLETE,
    ERROR;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static TraceEventType fromValue(String value) {
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
