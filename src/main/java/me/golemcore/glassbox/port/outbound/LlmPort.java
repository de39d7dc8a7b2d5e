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

import me.golemcore.glassbox.domain.model.LlmRequest;
import me.golemcore.glassbox.domain.model.LlmResponse;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Port for the LLM gateway. Stateless: every call carries the full transcript,
 * the tool schema and the credentials to use.
 */
public interface LlmPort {

    /**
     * Returns the adapter identifier (e.g., "langchain4j", "none").
     */
    String getProviderId();

    /**
     * Executes a chat completion request and returns the full response.
     */
    CompletableFuture<LlmResponse> chat(LlmRequest request);

    /**
     * Returns the provider families this adapter can reach.
     */
    List<String> getSupportedProviders();

    /**
     * Checks if the provider is configured and operational.
     */
    boolean isAvailable();
}
