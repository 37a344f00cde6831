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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.event.PipelineRunEvent;
import org.fireflyframework.dwh.query.QueryExecutor;
import org.fireflyframework.dwh.stage.StageResult;
import org.fireflyframework.dwh.stage.StageRunner;
import org.fireflyframework.dwh.stage.StageSpec;
import org.fireflyframework.dwh.stage.StageStatus;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Runs a {@link PipelineDefinition} stage by stage and aborts on the first failure.
 *
 * <p>State machine per run:</p>
 * <ol>
 *   <li>all stages start {@link StageStatus#PENDING}</li>
 *   <li>the current stage is marked {@link StageStatus#RUNNING} and handed to the {@link StageRunner}</li>
 *   <li>on success it becomes {@link StageStatus#SUCCEEDED} and the next stage starts</li>
 *   <li>on failure it becomes {@link StageStatus#FAILED}, every remaining stage is
 *       {@link StageStatus#SKIPPED} and the run ends {@link RunStatus#ABORTED}</li>
 *   <li>if every stage succeeds the run ends {@link RunStatus#COMPLETED}</li>
 * </ol>
 *
 * <p>A stage is subscribed to only after its predecessor has completed. The abort cause is the
 * failing stage's {@link org.fireflyframework.dwh.model.FailureCause}, unchanged. The executor keeps
 * no state between runs; concurrent runs are safe when the {@link QueryExecutor} is.</p>
 *
 * <p><b>Usage:</b></p>
 * <pre>{@code
 * PipelineExecutor executor = new PipelineExecutor(queryExecutor, new StageRunner(new AssertionEngine()));
 * PipelineRun run = executor.run(definition).block();
 * }</pre>
 */
@Slf4j
public class PipelineExecutor {

    private final QueryExecutor queryExecutor;
    private final StageRunner stageRunner;
    private final ApplicationEventPublisher eventPublisher;

    public PipelineExecutor(QueryExecutor queryExecutor, StageRunner stageRunner) {
        this(queryExecutor, stageRunner, null);
    }

    /**
     * Creates an executor.
     *
     * @param queryExecutor  the warehouse executor shared by every stage of a run
     * @param stageRunner    the runner executing individual stages
     * @param eventPublisher the event publisher, or {@code null} to disable event publishing
     */
    public PipelineExecutor(QueryExecutor queryExecutor, StageRunner stageRunner,
                            ApplicationEventPublisher eventPublisher) {
        this.queryExecutor = queryExecutor;
        this.stageRunner = stageRunner;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Runs an ad-hoc ordered list of stages.
     *
     * @param stages the stages in execution order
     * @return a {@link Mono} emitting the finished run
     */
    public Mono<PipelineRun> run(List<StageSpec> stages) {
        return Mono.defer(() -> run(PipelineDefinition.of("pipeline", stages)));
    }

    /**
     * Runs the given pipeline. The returned {@link Mono} emits one {@link PipelineRun} per
     * subscription; each subscription is an independent run.
     *
     * @param definition the pipeline to run
     * @return a {@link Mono} emitting the finished run
     */
    public Mono<PipelineRun> run(PipelineDefinition definition) {
        return Mono.defer(() -> {
            String runId = UUID.randomUUID().toString();
            Instant startedAt = Instant.now();
            List<StageSpec> stages = definition.getStages();
            List<StageResult> results = new ArrayList<>(stages.size());
            for (int i = 0; i < stages.size(); i++) {
                results.add(StageResult.pending(i + 1, stages.get(i)));
            }

            log.info("Starting pipeline '{}' run {} with {} stages", definition.getName(), runId, stages.size());

            return Flux.range(0, stages.size())
                    .concatMap(i -> executeStage(i, stages, results))
                    .takeUntil(StageResult::isFailed)
                    .then(Mono.fromSupplier(() -> finish(runId, definition, results, startedAt)))
                    .doOnNext(this::logRun)
                    .doOnNext(this::publishEvent);
        });
    }

    private Mono<StageResult> executeStage(int i, List<StageSpec> stages, List<StageResult> results) {
        return Mono.defer(() -> {
            StageSpec stage = stages.get(i);
            results.set(i, results.get(i).toBuilder().status(StageStatus.RUNNING).build());
            log.info("Stage {}/{} '{}' ({}) running", i + 1, stages.size(), stage.getId(), stage.getKind());

            return stageRunner.run(stage, queryExecutor)
                    .map(result -> result.toBuilder().index(i + 1).build())
                    .doOnNext(result -> {
                        results.set(i, result);
                        if (result.isFailed()) {
                            log.warn("Stage {}/{} '{}' failed after {}ms: {}", i + 1, stages.size(),
                                    stage.getId(), result.getDurationMs(), result.getCause().getMessage());
                        } else {
                            log.info("Stage {}/{} '{}' succeeded in {}ms", i + 1, stages.size(),
                                    stage.getId(), result.getDurationMs());
                        }
                    });
        });
    }

    private PipelineRun finish(String runId, PipelineDefinition definition, List<StageResult> results,
                               Instant startedAt) {
        int failedIndex = -1;
        for (int i = 0; i < results.size(); i++) {
            StageResult result = results.get(i);
            if (failedIndex >= 0) {
                results.set(i, result.toBuilder().status(StageStatus.SKIPPED).build());
            } else if (result.isFailed()) {
                failedIndex = i;
            }
        }

        PipelineRun.PipelineRunBuilder run = PipelineRun.builder()
                .runId(runId)
                .pipelineName(definition.getName())
                .stages(List.copyOf(results))
                .startedAt(startedAt)
                .finishedAt(Instant.now());

        if (failedIndex < 0) {
            return run.status(RunStatus.COMPLETED).build();
        }

        StageResult failed = results.get(failedIndex);
        return run.status(RunStatus.ABORTED)
                .abortedAtIndex(failedIndex + 1)
                .abortedStageId(failed.getStageId())
                .cause(failed.getCause())
                .build();
    }

    private void logRun(PipelineRun run) {
        if (run.isCompleted()) {
            log.info("Pipeline '{}' run {} completed", run.getPipelineName(), run.getRunId());
        } else {
            log.warn("Pipeline '{}' run {} aborted at stage {} '{}': {}; skipped {}",
                    run.getPipelineName(), run.getRunId(), run.getAbortedAtIndex(), run.getAbortedStageId(),
                    run.getCause().getMessage(), run.getSkippedStageIds());
        }
    }

    private void publishEvent(PipelineRun run) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new PipelineRunEvent(run));
        }
    }
}
