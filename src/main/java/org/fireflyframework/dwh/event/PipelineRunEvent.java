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

package org.fireflyframework.dwh.event;

import lombok.Data;
import org.fireflyframework.dwh.pipeline.PipelineRun;

import java.time.Instant;

/**
 * Event published by the {@link org.fireflyframework.dwh.pipeline.PipelineExecutor}
 * when a run reaches its terminal state.
 */
@Data
public class PipelineRunEvent {

    private final PipelineRun run;
    private final Instant timestamp;

    public PipelineRunEvent(PipelineRun run) {
        this.run = run;
        this.timestamp = Instant.now();
    }
}
