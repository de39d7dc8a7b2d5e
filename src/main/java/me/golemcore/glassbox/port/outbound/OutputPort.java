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

import me.golemcore.glassbox.domain.model.FileRecord;
import me.golemcore.glassbox.domain.model.NodeOutput;

import java.util.List;
import java.util.Optional;

/**
 * File records and node outputs.
 */
public interface OutputPort {

    /**
     * Writes the file record and the node output that references it.
     */
    void record(FileRecord file, NodeOutput output);

    void saveFile(FileRecord file);

    Optional<FileRecord> findFile(String fileId);

    List<NodeOutput> findOutputs(String nodeId);
}
