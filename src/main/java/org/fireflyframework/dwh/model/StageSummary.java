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
import org.fireflyframework.dwh.stage.StageKind;

import java.util.List;

/**
 * Response DTO describing one configured stage.
 */
@Data
@Builder
@Schema(description = "Configured pipeline stage")
public class StageSummary {

    @Schema(description = "1-based position in the pipeline", example = "1")
    private final int index;

    @Schema(description = "Stage identifier", example = "load_bronze")
    private final String id;

    @Schema(description = "Stage kind", example = "ACTION")
    private final StageKind kind;

    @Schema(description = "Action description, for action stages", example = "procedure bronze.load_bronze")
    private final String action;

    @Schema(description = "Assertion names in evaluation order, for quality gates")
    private final List<String> assertions;
}
