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

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dwh.model.FailureCause;
import org.fireflyframework.dwh.stage.StageResult;
import org.fireflyframework.dwh.stage.StageStatus;

import java.time.Instant;
import java.util.List;

/**
 * Result of one {@link PipelineExecutor} invocation: one {@link StageResult} per declared
 * stage, in order, and a single terminal status.
 *
 * <p>For an {@link RunStatus#ABORTED} run, {@code abortedAtIndex} (1-based), {@code abortedStageId}
 * and {@code cause} identify the one root cause; every later stage is {@link StageStatus#SKIPPED}.</p>
 */
@Data
@Builder
@Schema(description = "Outcome of one pipeline run")
public class PipelineRun {

    @Schema(description = "Unique run identifier")
    private final String runId;

    @Schema(description = "Pipeline name", example = "medallion")
    private final String pipelineName;

    @Schema(description = "Terminal run status", example = "ABORTED")
    private final RunStatus status;

    private final List<StageResult> stages;

    @Schema(description = "1-based index of the failing stage, for aborted runs", example = "3")
    private final Integer abortedAtIndex;

    @Schema(description = "Identifier of the failing stage, for aborted runs", example = "check_silver_quality")
    private final String abortedStageId;

    private final FailureCause cause;

    private final Instant startedAt;
    private final Instant finishedAt;

    public boolean isCompleted() {
        return status == RunStatus.COMPLETED;
    }

    /**
     * Returns the identifiers of the stages skipped after an abort, in order.
     *
     * @return the skipped stage ids, empty for completed runs
     */
    public List<String> getSkippedStageIds() {
        return stages.stream()
                .filter(stage -> stage.getStatus() == StageStatus.SKIPPED)
                .map(StageResult::getStageId)
                .toList();
    }
}
