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

import me.golemcore.glassbox.domain.model.ToolDefinition;
import me.golemcore.glassbox.tools.AddOutputTool;
import me.golemcore.glassbox.tools.CreateSubnodeTool;
import me.golemcore.glassbox.tools.MarkCompleteTool;
import me.golemcore.glassbox.tools.RequestHumanInputTool;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * The fixed set of tools offered to the model, in the order they are
 * advertised.
 */
@Component
public class AgentToolCatalog {

    private final CreateSubnodeTool createSubnodeTool;
    private final AddOutputTool addOutputTool;
    private final RequestHumanInputTool requestHumanInputTool;
    private final MarkCompleteTool markCompleteTool;

    public AgentToolCatalog(CreateSubnodeTool createSubnodeTool, AddOutputTool addOutputTool,
            RequestHumanInputTool requestHumanInputTool, MarkCompleteTool markCompleteTool) {
        this.createSubnodeTool = createSubnodeTool;
        this.addOutputTool = addOutputTool;
        this.requestHumanInputTool = requestHumanInputTool;
        this.markCompleteTool = markCompleteTool;
    }

    public List<ToolDefinition> getDefinitions() {
        return List.of(
                createSubnodeTool.getDefinition(),
                addOutputTool.getDefinition(),
                requestHumanInputTool.getDefinition(),
                markCompleteTool.getDefinition());
    }

    CreateSubnodeTool createSubnode() {
        return createSubnodeTool;
    }

    AddOutputTool addOutput() {
        return addOutputTool;
    }

    RequestHumanInputTool requestHumanInput() {
        return requestHumanInputTool;
    }

    MarkCompleteTool markComplete() {
        return markCompleteTool;
    }
}
