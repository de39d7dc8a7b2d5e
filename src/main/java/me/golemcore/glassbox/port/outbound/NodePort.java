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

import me.golemcore.glassbox.domain.model.Node;
import me.golemcore.glassbox.domain.model.NodeInput;

import java.util.List;
import java.util.Optional;

public interface NodePort {

    Optional<Node> findById(String nodeId);

    /**
     * Inputs of the node ordered by sort order.
     */
    List<NodeInput> findInputs(String nodeId);

    List<Node> findChildren(String parentId);

    void save(Node node);

    void saveInput(NodeInput input);
}
