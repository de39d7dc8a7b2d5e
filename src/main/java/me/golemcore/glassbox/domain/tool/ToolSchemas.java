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

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * JSON Schema fragments for tool parameter objects. Property order is kept as
 * declared.
 */
public final class ToolSchemas {

    private static final String TYPE = "type";
    private static final String DESCRIPTION = "description";

    private ToolSchemas() {
    }

    public static Map<String, Object> object(Map<String, Object> properties, List<String> required) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "object");
        schema.put("properties", properties);
        schema.put("required", List.copyOf(required));
        return schema;
    }

    public static Map<String, Object> properties(Object... nameSchemaPairs) {
        if (nameSchemaPairs.length % 2 != 0) {
            throw new IllegalArgumentException("Expected name/schema pairs");
        }
        Map<String, Object> properties = new LinkedHashMap<>();
        for (int i = 0; i < nameSchemaPairs.length; i += 2) {
            properties.put((String) nameSchemaPairs[i], nameSchemaPairs[i + 1]);
        }
        return properties;
    }

    public static Map<String, Object> string(String description) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "string");
        schema.put(DESCRIPTION, description);
        return schema;
    }

    public static Map<String, Object> enumString(List<String> values, String description) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "string");
        schema.put("enum", List.copyOf(values));
        schema.put(DESCRIPTION, description);
        return schema;
    }

    public static Map<String, Object> stringArray(String description) {
        Map<String, Object> schema = new LinkedHashMap<>();
        schema.put(TYPE, "array");
        schema.put("items", Map.of(TYPE, "string"));
        schema.put(DESCRIPTION, description);
        return schema;
    }
}
