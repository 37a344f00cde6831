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

package org.fireflyframework.dwh.model;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;
import org.fireflyframework.dwh.pipeline.PipelineRun;

import java.util.List;

/**
 * Response DTO for a triggered pipeline run.
 *
 * <p><b>Example Response:</b></p>
 * <pre>{@code
 * {
 *   "run": {
 *     "pipelineName": "medallion",
 *     "status": "ABORTED",
 *     "abortedAtIndex": 3,
 *     "abortedStageId": "check_silver_quality",
 *     "cause": {
 *       "kind": "ASSERTION_FAILURE",
 *       "stageId": "check_silver_quality",
 *       "assertionName": "duplicate customers",
 *       "message": "duplicate customers: expected 0, got 2"
 *     },
 *     "stages": [ ... ]
 *   },
 *   "report": [
 *     "Pipeline 'medallion' ABORTED at stage 3 (check_silver_quality)",
 *     "..."
 *   ]
 * }
 * }</pre>
 */
@Data
@Builder
@Schema(description = "Pipeline run with its rendered report")
public class PipelineRunResponse {

    @Schema(description = "Structured run outcome")
    private final PipelineRun run;

    @Schema(description = "Flat, ordered report lines")
    private final List<String> report;
}
