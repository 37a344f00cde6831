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

/**
 * Root cause of a failed stage, carried unchanged from the stage boundary
 * up to the run that it aborted.
 */
@Data
@Builder
@Schema(description = "Root cause of a failed stage")
public class FailureCause {

    @Schema(description = "Failure classification", example = "ASSERTION_FAILURE")
    private final FailureKind kind;

    @Schema(description = "Identifier of the stage that failed", example = "check_silver_quality")
    private final String stageId;

    @Schema(description = "Name of the failing assertion, for quality gate failures", example = "duplicate customers")
    private final String assertionName;

    @Schema(description = "Operator-facing failure reason", example = "duplicate customers: expected 0, got 2")
    private final String message;

    /**
     * Creates a cause for a stage that failed outside of any assertion.
     *
     * @param kind    the failure kind
     * @param stageId the failing stage
     * @param message the underlying reason, kept verbatim
     * @return the failure cause
     */
    public static FailureCause of(FailureKind kind, String stageId, String message) {
        return FailureCause.builder()
                .kind(kind)
                .stageId(stageId)
                .message(message)
                .build();
    }
}
