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

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Kind of artifact an agent attaches to a node, with the content type and file
 * extension used when it is written to blob storage.
 */
public enum OutputType {

    TEXT("text/plain", "txt"),
    STRUCTURED_DATA("application/json", "json"),
    FILE("application/octet-stream", "bin");

    private final String contentType;
    private final String extension;

    OutputType(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getContentType() {
        return contentType;
    }

    public String getExtension() {
        return extension;
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(OutputType::getValue).toList();
    }

    public static Optional<OutputType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.getValue().equals(value))
                .findFirst();
    }

    @JsonCreator
    public static OutputType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown output type: " + value));
    }
}
