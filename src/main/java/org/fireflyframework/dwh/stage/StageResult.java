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

package org.fireflyframework.dwh.stage;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dwh.model.FailureCause;
import org.fireflyframework.dwh.quality.GateOutcome;

/**
 * Status and outcome of one stage within a run.
 *
 * <p>{@code index} is the 1-based position in the pipeline. {@code cause} is set only for
 * {@link StageStatus#FAILED}; {@code gate} only for quality gates that ran.</p>
 */
@Data
@Builder(toBuilder = true)
@Schema(description = "Outcome of one pipeline stage")
public class StageResult {

    @Schema(description = "1-based position of the stage in the pipeline", example = "3")
    private final int index;

    @Schema(description = "Stage identifier", example = "check_silver_quality")
    private final String stageId;

    @Schema(description = "Stage kind", example = "QUALITY_GATE")
    private final StageKind kind;

    @Schema(description = "Stage status", example = "FAILED")
    private final StageStatus status;

    private final FailureCause cause;

    private final GateOutcome gate;

    @Schema(description = "Wall-clock duration of the stage in milliseconds", example = "42")
    private final long durationMs;

    public static StageResult pending(int index, StageSpec stage) {
        return StageResult.builder()
                .index(index)
                .stageId(stage.getId())
                .kind(stage.getKind())
                .status(StageStatus.PENDING)
                .build();
    }

    public boolean isFailed() {
        return status == StageStatus.FAILED;
    }
}
