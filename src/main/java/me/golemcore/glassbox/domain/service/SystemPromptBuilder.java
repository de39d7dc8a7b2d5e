package me.golemcore.glassbox.domain.service;

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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.NodeInput;
import me.golemcore.glassbox.port.outbound.OutputPort;
import me.golemcore.glassbox.port.outbound.TextExtractionPort;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Builds the opening system and user turns of a fresh execution from the node
 * and its inputs.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SystemPromptBuilder {

    static final String NOT_AVAILABLE = "N/A";
    static final String UNTITLED = "Untitled";

    private final OutputPort outputPort;
    private final TextExtractionPort textExtractionPort;

    public String buildSystemPrompt(Node node, List<NodeInput> inputs) {
        String inputsText = inputs.stream()
                .map(input -> "- " + inputName(input) + ": " + inputContent(input))
                .collect(Collectors.joining("\n"));

        return "You are an AI agent working on a task in GlassBox, a collaborative workspace.\n"
                + "\n"
                + "Task: " + title(node) + "\n"
                + "Description: " + orDefault(node.getDescription(), "No description provided") + "\n"
                + "\n"
                + "Available inputs:\n"
                + (inputsText.isEmpty() ? "No inputs provided" : inputsText) + "\n"
                + "\n"
                + "You have access to the following tools:\n"
                + "1. create_subnode - Break down this task into smaller sub-tasks\n"
                + "2. add_output - Add outputs (text, structured data, or files)\n"
                + "3. request_human_input - Ask the human supervisor for clarification\n"
                + "4. mark_complete - Mark this task as complete\n"
                + "\n"
                + "Work through the task step by step. If the task is complex, break it into sub-nodes.\n"
                + "When you have completed the task, use mark_complete with a summary.";
    }

    /**
     * First user turn. Some providers reject a transcript that holds only a
     * system turn.
     */
    public String buildKickoffMessage(Node node) {
        return "Please begin working on this task: " + title(node)
                + ". Analyze the inputs provided and use your tools to complete the work.";
    }

    private String inputName(NodeInput input) {
        return orDefault(input.getLabel(), input.getInputType());
    }

    private String inputContent(NodeInput input) {
        if (hasText(input.getTextContent())) {
            return input.getTextContent();
        }
        Optional<String> fileText = fileText(input);
        if (fileText.isPresent()) {
            return fileText.get();
        }
        if (hasText(input.getExternalUrl())) {
            return input.getExternalUrl();
        }
        return NOT_AVAILABLE;
    }

    private Optional<String> fileText(NodeInput input) {
        if (!hasText(input.getFileId())) {
            return Optional.empty();
        }
        Optional<FileRecord> file = outputPort.findFile(input.getFileId());
        if (file.isEmpty()) {
            log.warn("[Engine] Input {} references missing file {}", input.getId(), input.getFileId());
            return Optional.empty();
        }
        if (hasText(file.get().getExtractedText())) {
            return Optional.of(file.get().getExtractedText());
        }
        String extracted = textExtractionPort.extractText(file.get()).join();
        return hasText(extracted) ? Optional.of(extracted) : Optional.empty();
    }

    private String title(Node node) {
        return orDefault(node.getTitle(), UNTITLED);
    }

    private static String orDefault(String value, String fallback) {
        return hasText(value) ? value : fallback;
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
