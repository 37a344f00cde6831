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

package org.fireflyframework.dwh.query;

import reactor.core.publisher.Mono;

import java.math.BigDecimal;

/**
 * Port to the warehouse used by action stages and quality assertions.
 *
 * <p>Implementations adapt a concrete connection (JDBC, an HTTP SQL gateway, a test double)
 * to two narrow operations. Failures are signalled as {@code onError}, never swallowed:</p>
 * <ul>
 *   <li>{@link #execute(String)} completes empty when the command ran without error</li>
 *   <li>{@link #queryScalar(String)} emits the first column of the first row, or completes
 *       empty when there is no row or the value is SQL {@code NULL}</li>
 * </ul>
 *
 * <p>An executor instance is not shared across concurrently running pipelines unless
 * the implementation is safe for it (the JDBC adapter borrows a pooled connection per call).</p>
 */
public interface QueryExecutor {

    /**
     * Executes a command such as a procedure call or a multi-statement script.
     *
     * @param command the command text, passed to the warehouse as-is
     * @return a {@link Mono} completing empty on success, or erroring with the warehouse failure
     */
    Mono<Void> execute(String command);

    /**
     * Runs a read-only query expected to return a single numeric scalar.
     *
     * @param sql the query text
     * @return a {@link Mono} emitting the value, empty when absent, or erroring on failure
     */
    Mono<BigDecimal> queryScalar(String sql);
}
