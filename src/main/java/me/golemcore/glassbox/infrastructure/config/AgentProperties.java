package me.golemcore.glassbox.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Configuration of the agent worker, bound from application.properties under
 * the {@code glassbox.*} prefix.
 *
 * <ul>
 * <li>{@link LlmProperties} - gateway adapter, default model and provider
 * credentials</li>
 * <li>{@link EngineProperties} - iteration cap and tool-batch policy</li>
 * <li>{@link StorageProperties} - local workspace and bucket name</li>
 * <li>{@link WorkerProperties} - queue consumer</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "glassbox")
@Data
public class AgentProperties {

    private LlmProperties llm = new LlmProperties();
    private EngineProperties engine = new EngineProperties();
    private StorageProperties storage = new StorageProperties();
    private WorkerProperties worker = new WorkerProperties();

    @Data
    public static class LlmProperties {
        private String provider = "langchain4j";
        private String defaultModel = "anthropic/claude-sonnet-4-20250514";
        private long timeoutMs = 120_000;
        private int maxTokens = 4096;
        private Double temperature;
        private int rateLimitRetries = 0;
        private long rateLimitBackoffMs = 2_000;
        private Map<String, ProviderProperties> providers = new HashMap<>();
    }

    @Data
    public static class ProviderProperties {
        private String apiKey;
        private String baseUrl;
    }

    @Data
    public static class EngineProperties {
        private int maxIterations = 20;
        private boolean drainToolBatch = true;
        private int maxFaultRetries = 3;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
        private String bucket = "glassbox-files-dev";
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.glassbox/workspace";
    }

    @Data
    public static class WorkerProperties {
        private boolean enabled = true;
        private long pollIntervalMs = 1_000;
        private int batchSize = 10;
        private int concurrency = 4;
        private int visibilityTimeoutSeconds = 600;
    }
}
