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

package org.fireflyframework.dwh.controller;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.model.PipelineRunResponse;
import org.fireflyframework.dwh.model.StageSummary;
import org.fireflyframework.dwh.pipeline.PipelineDefinition;
import org.fireflyframework.dwh.pipeline.PipelineExecutor;
import org.fireflyframework.dwh.quality.AssertionSpec;
import org.fireflyframework.dwh.report.RunReportRenderer;
import org.fireflyframework.dwh.stage.StageKind;
import org.fireflyframework.dwh.stage.StageSpec;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * REST controller for triggering the configured pipeline and inspecting its stages.
 *
 * <p><b>Example:</b></p>
 * <pre>
 * POST /api/v1/pipeline/runs
 * GET  /api/v1/pipeline/stages
 * </pre>
 *
 * <p>A completed run answers {@code 200 OK}; an aborted run answers
 * {@code 422 Unprocessable Entity} with the same body, so callers can branch on status
 * while still reading the root cause and skipped stages.</p>
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/pipeline")
@Tag(name = "Pipeline Runs", description = "Quality-gated warehouse pipeline execution")
@ConditionalOnProperty(
    prefix = "firefly.dwh.pipeline",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class PipelineRunController {

    private final PipelineExecutor executor;
    private final PipelineDefinition definition;
    private final RunReportRenderer renderer;

    public PipelineRunController(PipelineExecutor executor, PipelineDefinition definition,
                                 RunReportRenderer renderer) {
        this.executor = executor;
        this.definition = definition;
        this.renderer = renderer;
    }

    /**
     * Runs the configured pipeline and returns its outcome with the rendered report.
     *
     * @return the run response
     */
    @PostMapping("/runs")
    @Operation(
        summary = "Run the pipeline",
        description = "Runs every configured stage in order and stops at the first failing stage. " +
                     "Quality gates abort the run exactly like failing data actions."
    )
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Run completed: every stage succeeded"),
        @ApiResponse(responseCode = "422", description = "Run aborted: the body names the root cause"),
        @ApiResponse(responseCode = "500", description = "Internal server error")
    })
    public Mono<ResponseEntity<PipelineRunResponse>> runPipeline() {
        log.info("Received run request for pipeline '{}'", definition.getName());
        return executor.run(definition)
                .map(run -> {
                    PipelineRunResponse body = PipelineRunResponse.builder()
                            .run(run)
                            .report(renderer.render(run))
                            .build();
                    HttpStatus status = run.isCompleted() ? HttpStatus.OK : HttpStatus.UNPROCESSABLE_ENTITY;
                    return ResponseEntity.status(status).body(body);
                });
    }

    /**
     * Lists the configured stages in execution order.
     *
     * @return the stage summaries
     */
    @GetMapping("/stages")
    @Operation(summary = "List pipeline stages", description = "Returns the configured stages in execution order.")
    @ApiResponses(value = {
        @ApiResponse(responseCode = "200", description = "Stages listed successfully")
    })
    public Mono<List<StageSummary>> listStages() {
        return Mono.fromCallable(() -> {
            List<StageSummary> summaries = new ArrayList<>();
            List<StageSpec> stages = definition.getStages();
            for (int i = 0; i < stages.size(); i++) {
                summaries.add(toSummary(i + 1, stages.get(i)));
            }
            return summaries;
        });
    }

    private static StageSummary toSummary(int index, StageSpec stage) {
        boolean action = stage.getKind() == StageKind.ACTION;
        return StageSummary.builder()
                .index(index)
                .id(stage.getId())
                .kind(stage.getKind())
                .action(action ? stage.getAction().describe() : null)
                .assertions(stage.getAssertions().stream().map(AssertionSpec::getName).toList())
                .build();
    }
}
