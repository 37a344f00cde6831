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

package org.fireflyframework.dwh.report;

import org.fireflyframework.dwh.pipeline.PipelineRun;
import org.fireflyframework.dwh.quality.AssertionOutcome;
import org.fireflyframework.dwh.stage.StageResult;
import org.fireflyframework.dwh.stage.StageStatus;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders a {@link PipelineRun} as a flat, ordered list of log lines.
 *
 * <p>Lines carry no run ids or timestamps, so two runs against the same data render identically.
 * Example for an aborted run:</p>
 * <pre>
 * Pipeline 'medallion' ABORTED at stage 3 (check_silver_quality)
 * [1] load_bronze ACTION SUCCEEDED
 * [2] load_silver ACTION SUCCEEDED
 * [3] check_silver_quality QUALITY_GATE FAILED: duplicate customers: expected 0, got 2
 *     - duplicate customers EQUALS expected=0 actual=2 FAILED
 *     - null customer ids EQUALS expected=0 actual=- NOT_RUN
 * [4] create_gold_views ACTION SKIPPED
 * [5] check_gold_quality QUALITY_GATE SKIPPED
 * Root cause (ASSERTION_FAILURE): duplicate customers: expected 0, got 2
 * Skipped stages: create_gold_views, check_gold_quality
 * </pre>
 */
public class RunReportRenderer {

    private static final String NO_VALUE = "-";

    /**
     * Renders the run.
     *
     * @param run the finished run
     * @return the report lines, in order
     */
    public List<String> render(PipelineRun run) {
        List<String> lines = new ArrayList<>();
        lines.add(header(run));

        for (StageResult stage : run.getStages()) {
            StringBuilder line = new StringBuilder()
                    .append('[').append(stage.getIndex()).append("] ")
                    .append(stage.getStageId()).append(' ')
                    .append(stage.getKind()).append(' ')
                    .append(stage.getStatus());
            if (stage.getStatus() == StageStatus.FAILED && stage.getCause() != null) {
                line.append(": ").append(stage.getCause().getMessage());
            }
            lines.add(line.toString());

            if (stage.getGate() != null) {
                for (AssertionOutcome outcome : stage.getGate().getOutcomes()) {
                    lines.add("    - " + outcome.getName() + ' '
                            + outcome.getComparator() + " expected=" + format(outcome.getExpected())
                            + " actual=" + format(outcome.getActual()) + ' '
                            + outcome.getStatus());
                }
            }
        }

        if (!run.isCompleted()) {
            lines.add("Root cause (" + run.getCause().getKind() + "): " + run.getCause().getMessage());
            List<String> skipped = run.getSkippedStageIds();
            lines.add("Skipped stages: " + (skipped.isEmpty() ? "none" : String.join(", ", skipped)));
        }
        return lines;
    }

    private static String header(PipelineRun run) {
        if (run.isCompleted()) {
            return "Pipeline '" + run.getPipelineName() + "' COMPLETED (" + run.getStages().size() + " stages)";
        }
        return "Pipeline '" + run.getPipelineName() + "' ABORTED at stage " + run.getAbortedAtIndex()
                + " (" + run.getAbortedStageId() + ")";
    }

    private static String format(BigDecimal value) {
        return value == null ? NO_VALUE : value.stripTrailingZeros().toPlainString();
    }
}
