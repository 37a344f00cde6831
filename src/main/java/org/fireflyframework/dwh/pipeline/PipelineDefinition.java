/*
 * Copyright 2024-2026 Firefly Software Solutions Inc
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
 */

package org.fireflyframework.dwh.pipeline;

import lombok.Getter;
import lombok.ToString;
import org.fireflyframework.dwh.stage.StageSpec;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A named, totally ordered sequence of stages. There is no branching: each stage's
 * predecessor is the one before it in the list.
 */
@Getter
@ToString
public final class PipelineDefinition {

    private final String name;
    private final List<StageSpec> stages;

    private PipelineDefinition(String name, List<StageSpec> stages) {
        this.name = name;
        this.stages = stages;
    }

    /**
     * Creates a definition after checking stage ids are unique.
     *
     * @param name   the pipeline name
     * @param stages the stages in execution order
     * @return the definition
     * @throws PipelineDefinitionException if stage ids repeat or a stage is {@code null}
     */
    public static PipelineDefinition of(String name, List<StageSpec> stages) {
        List<String> errors = new ArrayList<>();
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < stages.size(); i++) {
            StageSpec stage = stages.get(i);
            if (stage == null) {
                errors.add("stage " + (i + 1) + " is null");
            } else if (!ids.add(stage.getId())) {
                errors.add("stage id '" + stage.getId() + "' is used more than once");
            }
        }
        if (!errors.isEmpty()) {
            throw new PipelineDefinitionException("Invalid pipeline '" + name + "': "
                    + String.join("; ", errors), errors);
        }
        return new PipelineDefinition(name, List.copyOf(stages));
    }
}
