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

package org.fireflyframework.dwh.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.action.ActionSource;
import org.fireflyframework.dwh.action.InlineActionSource;
import org.fireflyframework.dwh.action.ProcedureCallActionSource;
import org.fireflyframework.dwh.action.ScriptResourceActionSource;
import org.fireflyframework.dwh.pipeline.PipelineDefinition;
import org.fireflyframework.dwh.pipeline.PipelineDefinitionException;
import org.fireflyframework.dwh.quality.AssertionSpec;
import org.fireflyframework.dwh.stage.StageKind;
import org.fireflyframework.dwh.stage.StageSpec;
import org.springframework.core.io.ResourceLoader;
import org.springframework.util.StringUtils;

import java.util.ArrayList;
import java.util.List;

/**
 * Builds a {@link PipelineDefinition} from {@link PipelineProperties}.
 *
 * <p>All stages are checked before failing, so a single {@link PipelineDefinitionException}
 * reports every configuration problem at once.</p>
 */
@Slf4j
public class PipelineDefinitionFactory {

    private final ResourceLoader resourceLoader;

    public PipelineDefinitionFactory(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    /**
     * Creates the definition.
     *
     * @param properties the bound pipeline properties
     * @return the pipeline definition
     * @throws PipelineDefinitionException if any stage is invalid
     */
    public PipelineDefinition create(PipelineProperties properties) {
        List<String> errors = new ArrayList<>();
        List<StageSpec> stages = new ArrayList<>();

        List<PipelineProperties.Stage> configured = properties.getStages();
        for (int i = 0; i < configured.size(); i++) {
            PipelineProperties.Stage stage = configured.get(i);
            try {
                stages.add(toStage(stage));
            } catch (IllegalArgumentException e) {
                errors.add("stage " + (i + 1) + " ('" + stage.getId() + "'): " + e.getMessage());
            }
        }

        if (!errors.isEmpty()) {
            throw new PipelineDefinitionException("Invalid pipeline '" + properties.getName() + "': "
                    + String.join("; ", errors), errors);
        }
        if (stages.isEmpty()) {
            log.warn("Pipeline '{}' declares no stages; every run will complete immediately", properties.getName());
        }

        PipelineDefinition definition = PipelineDefinition.of(properties.getName(), stages);
        log.info("Loaded pipeline '{}' with stages {}", definition.getName(),
                stages.stream().map(StageSpec::getId).toList());
        return definition;
    }

    private StageSpec toStage(PipelineProperties.Stage stage) {
        StageKind kind = resolveKind(stage);
        if (kind == StageKind.QUALITY_GATE) {
            if (actionSourceCount(stage) > 0) {
                throw new IllegalArgumentException("a quality gate must not declare command, procedure or script");
            }
            List<AssertionSpec> assertions = stage.getAssertions().stream()
                    .map(assertion -> AssertionSpec.builder()
                            .name(assertion.getName())
                            .query(assertion.getQuery())
                            .comparator(assertion.getComparator())
                            .expected(assertion.getExpected())
                            .build())
                    .toList();
            return StageSpec.qualityGate(stage.getId(), assertions);
        }

        if (!stage.getAssertions().isEmpty()) {
            throw new IllegalArgumentException("an action stage must not declare assertions");
        }
        if (actionSourceCount(stage) != 1) {
            throw new IllegalArgumentException("an action stage needs exactly one of command, procedure or script");
        }
        return StageSpec.action(stage.getId(), toActionSource(stage));
    }

    private ActionSource toActionSource(PipelineProperties.Stage stage) {
        if (StringUtils.hasText(stage.getCommand())) {
            return new InlineActionSource(stage.getCommand());
        }
        if (StringUtils.hasText(stage.getProcedure())) {
            return new ProcedureCallActionSource(stage.getProcedure(), stage.getArguments(), stage.isNormalizePaths());
        }
        return new ScriptResourceActionSource(resourceLoader.getResource(stage.getScript()));
    }

    private static StageKind resolveKind(PipelineProperties.Stage stage) {
        if (stage.getKind() != null) {
            return stage.getKind();
        }
        return stage.getAssertions().isEmpty() ? StageKind.ACTION : StageKind.QUALITY_GATE;
    }

    private static int actionSourceCount(PipelineProperties.Stage stage) {
        int count = 0;
        if (StringUtils.hasText(stage.getCommand())) {
            count++;
        }
        if (StringUtils.hasText(stage.getProcedure())) {
            count++;
        }
        if (StringUtils.hasText(stage.getScript())) {
            count++;
        }
        return count;
    }
}
