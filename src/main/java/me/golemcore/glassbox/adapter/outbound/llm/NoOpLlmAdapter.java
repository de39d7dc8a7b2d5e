package me.golemcore.glassbox.adapter.outbound.llm;

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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.LlmRequest;
import me.golemcore.glassbox.domain.model.LlmResponse;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fallback gateway used when no LLM provider is configured. Every call fails,
 * so an execution started without a provider ends as {@code failed} with a
 * clear message instead of looping on placeholder answers.
 *
 * <p>
 * Provider ID: {@code "none"}
 */
@Component
@Slf4j
public class NoOpLlmAdapter implements LlmProviderAdapter {

    static final String NOT_CONFIGURED = "No LLM provider configured";

    @Override
    public String getProviderId() {
        return "none";
    }

    @Override
    public CompletableFuture<LlmResponse> chat(LlmRequest request) {
        log.warn("[LLM] chat() called for execution {} but no LLM is configured", request.getExecutionId());
        return CompletableFuture.failedFuture(new IllegalStateException(NOT_CONFIGURED));
    }

    @Override
    public List<String> getSupportedProviders() {
        return List.of();
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
