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

package org.fireflyframework.dwh.quality;

import io.swagger.v3.oas.annotations.media.Schema;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;

/**
 * Aggregated result of a quality gate, one {@link AssertionOutcome} per declared assertion
 * in declared order.
 */
@Data
@Builder
@Schema(description = "Outcome of a quality gate")
public class GateOutcome {

    private final boolean passed;
    private final QualityStrategy strategy;
    private final List<AssertionOutcome> outcomes;
    private final AssertionOutcome firstFailure;
    private final int passedCount;
    private final int failedCount;
    private final int notRunCount;
    private final Instant evaluatedAt;

    /**
     * Returns the outcomes that failed or errored, in declared order.
     *
     * @return the failing outcomes
     */
    public List<AssertionOutcome> getFailures() {
        return outcomes.stream()
                .filter(AssertionOutcome::isFailure)
                .toList();
    }
}
