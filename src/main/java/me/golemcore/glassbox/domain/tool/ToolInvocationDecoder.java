package me.golemcore.glassbox.domain.tool;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import me.golemcore.glassbox.domain.exception.InvalidToolArgumentException;
import me.golemcore.glassbox.domain.exception.ToolArgumentsException;
import me.golemcore.glassbox.domain.exception.UnknownToolException;
import me.golemcore.glassbox.domain.model.AuthorType;
import me.golemcore.glassbox.domain.model.Message;
import me.golemcore.glassbox.domain.model.OutputType;
import me.golemcore.glassbox.domain.model.ToolInvocation;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a raw {@link Message.ToolCall} into a {@link ToolInvocation}.
 *
 * <p>
 * Three outcomes besides success: arguments that are not a JSON object throw
 * {@link ToolArgumentsException}; a name outside the catalogue throws
 * {@link UnknownToolException}; a parseable payload that breaks the tool's
 * contract throws {@link InvalidToolArgumentException}.
 */
@Component
@RequiredArgsConstructor
public class ToolInvocationDecoder {

    private final ObjectMapper objectMapper;

    /**
     * Parses the raw argument string. Missing arguments read as an empty object.
     */
    public JsonNode parseArguments(Message.ToolCall toolCall) {
        String raw = toolCall.getArguments();
        if (raw == null || raw.isBlank()) {
            return objectMapper.createObjectNode();
        }
        JsonNode node;
        try {
            node = objectMapper.readTree(raw);
        } catch (JsonProcessingException e) {
            throw new ToolArgumentsException(toolCall.getName(),
                    "Malformed arguments for tool " + toolCall.getName() + ": " + e.getOriginalMessage(), e);
        }
        if (node == null || !node.isObject()) {
            throw new ToolArgumentsException(toolCall.getName(),
                    "Arguments for tool " + toolCall.getName() + " must be a JSON object", null);
        }
        return node;
    }

    public ToolInvocation decode(String toolName, JsonNode arguments)
            throws UnknownToolException, InvalidToolArgumentException {
        if (toolName == null) {
            throw new UnknownToolException("null");
        }
        return switch (toolName) {
        case ToolInvocation.CREATE_SUBNODE -> new ToolInvocation.CreateSubnode(
                requiredText(arguments, "title"),
                optionalText(arguments, "description"),
                AuthorType.parse(requiredText(arguments, "author_type"))
                        .orElseThrow(() -> invalidEnum("author_type", AuthorType.wireValues())));
        case ToolInvocation.ADD_OUTPUT -> new ToolInvocation.AddOutput(
                OutputType.parse(requiredText(arguments, "type"))
                        .orElseThrow(() -> invalidEnum("type", OutputType.wireValues())),
                requiredContent(arguments),
                optionalText(arguments, "label"));
        case ToolInvocation.REQUEST_HUMAN_INPUT -> new ToolInvocation.RequestHumanInput(
                requiredText(arguments, "question"),
                optionalStringList(arguments, "options"));
        case ToolInvocation.MARK_COMPLETE -> new ToolInvocation.MarkComplete(
                orEmpty(optionalText(arguments, "summary")));
        default -> throw new UnknownToolException(toolName);
        };
    }

    private static String orEmpty(String value) {
        return value != null ? value : "";
    }

    private String requiredText(JsonNode arguments, String field) throws InvalidToolArgumentException {
        JsonNode value = arguments.get(field);
        if (value == null || value.isNull()) {
            throw new InvalidToolArgumentException("Missing required argument: " + field);
        }
        if (!value.isTextual()) {
            throw new InvalidToolArgumentException("Argument " + field + " must be a string");
        }
        return value.asText();
    }

    // Models sometimes send structured_data content as an inline object.
    private String requiredContent(JsonNode arguments) throws InvalidToolArgumentException {
        JsonNode value = arguments.get("content");
        if (value == null || value.isNull()) {
            throw new InvalidToolArgumentException("Missing required argument: content");
        }
        return value.isTextual() ? value.asText() : value.toString();
    }

    private String optionalText(JsonNode arguments, String field) throws InvalidToolArgumentException {
        JsonNode value = arguments.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (!value.isTextual()) {
            throw new InvalidToolArgumentException("Argument " + field + " must be a string");
        }
        return value.asText();
    }

    private List<String> optionalStringList(JsonNode arguments, String field) throws InvalidToolArgumentException {
        JsonNode value = arguments.get(field);
        if (value == null || value.isNull()) {
            return List.of();
        }
        if (!value.isArray()) {
            throw new InvalidToolArgumentException("Argument " + field + " must be an array of strings");
        }
        List<String> items = new ArrayList<>();
        for (JsonNode item : value) {
            if (!item.isTextual()) {
                throw new InvalidToolArgumentException("Argument " + field + " must be an array of strings");
            }
            items.add(item.asText());
        }
        return items;
    }

    private InvalidToolArgumentException invalidEnum(String field, List<String> allowed) {
        return new InvalidToolArgumentException("Argument " + field + " must be one of " + allowed);
    }
}
