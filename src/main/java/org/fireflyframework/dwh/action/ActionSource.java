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

package org.fireflyframework.dwh.action;

/**
 * Supplies the command text of an action stage.
 *
 * <p>The pipeline treats the returned text as opaque: it is handed to the
 * {@link org.fireflyframework.dwh.query.QueryExecutor} without parsing or validation.
 * Resolution happens when the stage runs, so a script edited between runs is picked up.</p>
 */
@FunctionalInterface
public interface ActionSource {

    /**
     * Resolves the command to execute.
     *
     * @return the command text
     * @throws ActionSourceException if the command cannot be produced
     */
    String resolveCommand();

    /**
     * Returns a short human-readable description used in logs.
     *
     * @return the description
     */
    default String describe() {
        return getClass().getSimpleName();
    }
}
