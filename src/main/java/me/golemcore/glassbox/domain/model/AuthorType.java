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
 * Who is expected to carry out a node: an agent or a human.
 */
public enum AuthorType {

    AGENT, HUMAN;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> wireValues() {
        return Arrays.stream(values()).map(AuthorType::getValue).toList();
    }

    public static Optional<AuthorType> parse(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
                .filter(type -> type.getValue().equals(value))
                .findFirst();
    }

    @JsonCreator
    public static AuthorType fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown author type: " + value));
    }
}
