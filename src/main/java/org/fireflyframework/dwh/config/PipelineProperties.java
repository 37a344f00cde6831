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

package org.fireflyframework.dwh.config;

import lombok.Data;
import org.fireflyframework.dwh.quality.AssertionComparator;
import org.fireflyframework.dwh.quality.QualityStrategy;
import org.fireflyframework.dwh.stage.StageKind;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Configuration properties describing the pipeline as data.
 *
 * <p>An action stage sets exactly one of {@code command}, {@code procedure} (with
 * {@code arguments}) or {@code script}. A quality gate lists its {@code assertions}.
 * When {@code kind} is omitted it is inferred from whether assertions are present.</p>
 *
 * <p><b>Example Configuration:</b></p>
 * <pre>{@code
 * firefly:
 *   dwh:
 *     pipeline:
 *       name: medallion
 *       strategy: fail-fast
 *       query-timeout: 10m
 *       stages:
 *         - id: load_silver
 *           kind: action
 *           command: "CALL silver.load_silver();"
 *         - id: check_silver_quality
 *           kind: quality-gate
 *           assertions:
 *             - name: No NULL customer IDs in silver.crm_cust_info
 *               query: "SELECT COUNT(*) FROM silver.crm_cust_info WHERE cst_id IS NULL"
 *               comparator: equals
 *               expected: 0
 * }</pre>
 */
@Data
@ConfigurationProperties(prefix = "firefly.dwh.pipeline")
public class PipelineProperties {

    /**
     * Whether the pipeline beans are created.
     */
    private boolean enabled = true;

    /**
     * Pipeline name used in logs and reports.
     */
    private String name = "pipeline";

    /**
     * Quality gate evaluation policy.
     */
    private QualityStrategy strategy = QualityStrategy.FAIL_FAST;

    /**
     * Per-call timeout applied to warehouse commands and queries. Unset means no timeout.
     */
    private Duration queryTimeout;

    /**
     * Run the pipeline once when the application starts.
     */
    private boolean runOnStartup = false;

    /**
     * Stages in execution order.
     */
    private List<Stage> stages = new ArrayList<>();

    @Data
    public static class Stage {

        private String id;

        private StageKind kind;

        /**
         * Literal command text.
         */
        private String command;

        /**
         * Stored procedure to call with {@link #arguments}.
         */
        private String procedure;

        private List<String> arguments = new ArrayList<>();

        /**
         * Treat procedure arguments as directory paths (forward slashes, trailing slash).
         */
        private boolean normalizePaths = false;

        /**
         * Location of a SQL script, e.g. {@code classpath:sql/gold/ddl_gold.sql} or {@code file:/opt/sql/x.sql}.
         */
        private String script;

        private List<Assertion> assertions = new ArrayList<>();
    }

    @Data
    public static class Assertion {

        private String name;

        private String query;

        private AssertionComparator comparator = AssertionComparator.EQUALS;

        private BigDecimal expected = BigDecimal.ZERO;
    }
}
