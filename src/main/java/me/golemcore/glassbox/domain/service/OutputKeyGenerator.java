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
import me.golemcore.glassbox.domain.model.OutputType;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;

/**
 * Blob keys for agent outputs:
 * {@code outputs/<orgId>/<executionId>/<yyyyMMdd_HHmmss>_<type>_<8 hex>.<ext>}
 * with the timestamp in UTC.
 */
@Service
@RequiredArgsConstructor
public class OutputKeyGenerator {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss")
            .withZone(ZoneOffset.UTC);

    private final Clock clock;

    public String generate(String orgId, String executionId, OutputType type) {
        String unique = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
        return "outputs/" + orgId + "/" + executionId + "/"
                + TIMESTAMP.format(clock.instant()) + "_" + type.getValue() + "_" + unique
                + "." + type.getExtension();
    }
}
