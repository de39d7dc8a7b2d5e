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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Structured question the agent left for a human supervisor.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class HumanInputRequest {

    public static final String TYPE_QUESTION = "question";

    @Builder.Default
    private String requestType = TYPE_QUESTION;
    private String prompt;
    @Builder.Default
    private List<String> options = new ArrayList<>();

    public static HumanInputRequest question(String prompt, List<String> options) {
        return HumanInputRequest.builder()
                .prompt(prompt)
                .options(options != null ? new ArrayList<>(options) : new ArrayList<>())
                .build();
    }
}
