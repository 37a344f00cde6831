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

/**
 * Evaluation policy of a quality gate.
 *
 * <ul>
 *   <li>{@link #FAIL_FAST} - stop at the first failed or errored assertion; the rest stay {@code NOT_RUN}</li>
 *   <li>{@link #COLLECT_ALL} - run every assertion; the gate still reports the first failure in
 *       declared order as its cause</li>
 * </ul>
 */
public enum QualityStrategy {

    FAIL_FAST,
    COLLECT_ALL
}
