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
import org.fireflyframework.dwh.model.FailureKind;

import java.math.BigDecimal;

/**
 * Result of evaluating a single {@link AssertionSpec}.
 *
 * <p>{@code actual} is {@code null} when the query errored, returned no value, or did not run.
 * {@code reason} and {@code failureKind} are set for {@link AssertionStatus#FAILED} and
 * {@link AssertionStatus#ERROR} outcomes only.</p>
 */
@Data
@Builder
@Schema(description = "Outcome of a single assertion")
public class AssertionOutcome {

    private final String name;
    private final AssertionComparator comparator;
    private final BigDecimal expected;
    private final BigDecimal actual;
    private final AssertionStatus status;
    private final FailureKind failureKind;
    private final String reason;
    private final long durationMs;

    /**
     * Creates the outcome of an assertion that was never executed.
     *
     * @param assertion the assertion declaration
     * @return a {@link AssertionStatus#NOT_RUN} outcome
     */
    public static AssertionOutcome notRun(AssertionSpec assertion) {
        return AssertionOutcome.builder()
                .name(assertion.getName())
                .comparator(assertion.getComparator())
                .expected(assertion.getExpected())
                .status(AssertionStatus.NOT_RUN)
                .build();
    }

    public boolean isPassed() {
        return status == AssertionStatus.PASSED;
    }

    public boolean isFailure() {
        return status == AssertionStatus.FAILED || status == AssertionStatus.ERROR;
    }
}
