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

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Lifecycle status of an {@link Execution}.
 *
 * <p>
 * {@code pending -> running -> {paused, awaiting_input, complete, failed, cancelled}}.
 * {@link #PAUSED} and {@link #AWAITING_INPUT} may return to {@link #RUNNING};
 * the remaining three are terminal. A {@link #FAILED} execution whose fault is
 * still retryable is the one exception (see {@link Execution#isResumableAfterFault()}).
 */
public enum ExecutionStatus {

    PENDING, RUNNING, PAUSED, AWAITING_INPUT, COMPLETE, FAILED, CANCELLED;

    /**
     * Statuses for which an execution still occupies its node.
     */
    public static final Set<ExecutionStatus> ACTIVE = EnumSet.of(PENDING, RUNNING, PAUSED, AWAITING_INPUT);

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public boolean isTerminal() {
        return this == COMPLETE || this == FAILED || this == CANCELLED;
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    @JsonCreator
    public static ExecutionStatus fromValue(String value) {
        if (value == null) {
            return null;
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
