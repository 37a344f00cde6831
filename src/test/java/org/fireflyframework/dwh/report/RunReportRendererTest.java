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

import org.fireflyframework.dwh.pipeline.PipelineExecutor;
import org.fireflyframework.dwh.pipeline.PipelineRun;
import org.fireflyframework.dwh.quality.AssertionEngine;
import org.fireflyframework.dwh.stage.StageRunner;
import org.fireflyframework.dwh.support.RecordingQueryExecutor;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.fireflyframework.dwh.support.MedallionFixtures.DUPLICATE_CUSTOMERS;
import static org.fireflyframework.dwh.support.MedallionFixtures.healthyWarehouse;
import static org.fireflyframework.dwh.support.MedallionFixtures.medallion;

/**
 * Tests for {@link RunReportRenderer}.
 */
class RunReportRendererTest {

    private final RunReportRenderer renderer = new RunReportRenderer();

    private static PipelineRun run(RecordingQueryExecutor warehouse) {
        return new PipelineExecutor(warehouse, new StageRunner(new AssertionEngine()))
                .run(medallion())
                .block();
    }

    @Test
    void render_shouldListEveryStageAndAssertionOfCompletedRun() {
        // When
        List<String> lines = renderer.render(run(healthyWarehouse()));

        // Then
        assertThat(lines).containsExactly(
                "Pipeline 'medallion' COMPLETED (5 stages)",
                "[1] load_bronze ACTION SUCCEEDED",
                "[2] load_silver ACTION SUCCEEDED",
                "[3] check_silver_quality QUALITY_GATE SUCCEEDED",
                "    - duplicate customers EQUALS expected=0 actual=0 PASSED",
                "    - null customer ids EQUALS expected=0 actual=0 PASSED",
                "    - duplicate products EQUALS expected=0 actual=0 PASSED",
                "[4] create_gold_views ACTION SUCCEEDED",
                "[5] check_gold_quality QUALITY_GATE SUCCEEDED",
                "    - null customer keys EQUALS expected=0 actual=0 PASSED",
                "    - completeness GREATER_OR_EQUAL expected=95 actual=98.5 PASSED");
    }

    @Test
    void render_shouldShowSingleRootCauseAndSkippedStagesOfAbortedRun() {
        // When
        List<String> lines = renderer.render(run(healthyWarehouse().scalar(DUPLICATE_CUSTOMERS, "2")));

        // Then
        assertThat(lines).containsExactly(
                "Pipeline 'medallion' ABORTED at stage 3 (check_silver_quality)",
                "[1] load_bronze ACTION SUCCEEDED",
                "[2] load_silver ACTION SUCCEEDED",
                "[3] check_silver_quality QUALITY_GATE FAILED: duplicate customers: expected 0, got 2",
                "    - duplicate customers EQUALS expected=0 actual=2 FAILED",
                "    - null customer ids EQUALS expected=0 actual=- NOT_RUN",
                "    - duplicate products EQUALS expected=0 actual=- NOT_RUN",
                "[4] create_gold_views ACTION SKIPPED",
                "[5] check_gold_quality QUALITY_GATE SKIPPED",
                "Root cause (ASSERTION_FAILURE): duplicate customers: expected 0, got 2",
                "Skipped stages: create_gold_views, check_gold_quality");
    }
}
