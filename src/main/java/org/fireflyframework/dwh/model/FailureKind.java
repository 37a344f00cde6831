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

/**
 * Classification of the failures that abort a pipeline run.
 *
 * <ul>
 *   <li>{@link #QUERY_EXECUTION_ERROR} - the warehouse could not run a command or query
 *       (connectivity, syntax, permission, missing script)</li>
 *   <li>{@link #ASSERTION_FAILURE} - the query ran but the comparison did not hold</li>
 *   <li>{@link #MISSING_RESULT} - the query ran but returned no scalar value</li>
 * </ul>
 *
 * <p>All kinds are fatal to the run; none is downgraded to a warning.</p>
 */
public enum FailureKind {

    QUERY_EXECUTION_ERROR,
    ASSERTION_FAILURE,
    MISSING_RESULT
}
