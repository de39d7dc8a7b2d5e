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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Queue payload asking a worker to run (or resume) one execution.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AgentJob {

    @JsonProperty("node_id")
    @JsonAlias("nodeId")
    private String nodeId;

    @JsonProperty("execution_id")
    @JsonAlias("executionId")
    private String executionId;

    @JsonProperty("org_id")
    @JsonAlias("orgId")
    private String orgId;

    @JsonProperty("org_config")
    @JsonAlias("orgConfig")
    private OrgConfig orgConfig;

    @JsonIgnore
    public boolean isWellFormed() {
        return nodeId != null && !nodeId.isBlank() && executionId != null && !executionId.isBlank();
    }
}
