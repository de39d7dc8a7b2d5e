package me.golemcore.glassbox.domain.loop;

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

import me.golemcore.glassbox.domain.model.ExecutionStatus;
import me.golemcore.glassbox.domain.model.TokenTotals;

/**
 * How a call to {@link ExecutionController#run} ended. {@code ran} is false
 * when the execution was not in a runnable status and nothing was done.
 */
public record ExecutionOutcome(String executionId, ExecutionStatus status, int iterations, TokenTotals tokens,
        boolean ran) {

    static ExecutionOutcome skipped(String executionId, ExecutionStatus status, TokenTotals tokens) {
        return new ExecutionOutcome(executionId, status, 0, tokens, false);
    }
}
