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

import java.math.BigDecimal;

/**
 * Declarative data-quality rule: a scalar query plus the comparison its result must satisfy.
 *
 * <p><b>Example:</b></p>
 * <pre>{@code
 * AssertionSpec noDuplicates = AssertionSpec.builder()
 *         .name("No duplicate customers in silver.crm_cust_info")
 *         .query("SELECT COUNT(*) FROM (SELECT cst_id FROM silver.crm_cust_info "
 *                 + "GROUP BY cst_id HAVING COUNT(*) > 1) d")
 *         .comparator(AssertionComparator.EQUALS)
 *         .expected(BigDecimal.ZERO)
 *         .build();
 * }</pre>
 *
 * <p>Names are unique within a gate only. Queries must be read-only.</p>
 */
@Data
@Builder
@Schema(description = "Data-quality assertion declaration")
public class AssertionSpec {

    @Schema(description = "Human-readable assertion name", example = "No NULL customer IDs in silver.crm_cust_info")
    private final String name;

    @Schema(description = "Query returning exactly one scalar")
    private final String query;

    @Schema(description = "Comparator applied to the query result", example = "EQUALS")
    private final AssertionComparator comparator;

    @Schema(description = "Expected value or threshold", example = "0")
    private final BigDecimal expected;
}
