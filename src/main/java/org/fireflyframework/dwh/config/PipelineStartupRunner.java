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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.pipeline.PipelineDefinition;
import org.fireflyframework.dwh.pipeline.PipelineExecutor;
import org.fireflyframework.dwh.pipeline.PipelineRun;
import org.fireflyframework.dwh.report.RunReportRenderer;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;

/**
 * Runs the configured pipeline once at startup and logs the run report.
 *
 * <p>An aborted run fails startup with a {@link PipelineAbortedException}, so a scheduler
 * invoking the application sees a non-zero exit code.</p>
 */
@Slf4j
public class PipelineStartupRunner implements ApplicationRunner {

    private final PipelineExecutor executor;
    private final PipelineDefinition definition;
    private final RunReportRenderer renderer;

    public PipelineStartupRunner(PipelineExecutor executor, PipelineDefinition definition,
                                 RunReportRenderer renderer) {
        this.executor = executor;
        this.definition = definition;
        this.renderer = renderer;
    }

    @Override
    public void run(ApplicationArguments args) {
        PipelineRun run = executor.run(definition).block();
        renderer.render(run).forEach(line -> log.info("{}", line));
        if (!run.isCompleted()) {
            throw new PipelineAbortedException(run);
        }
    }

    /**
     * Raised when the startup run ends aborted.
     */
    public static class PipelineAbortedException extends RuntimeException {

        private final transient PipelineRun run;

        public PipelineAbortedException(PipelineRun run) {
            super("Pipeline '" + run.getPipelineName() + "' aborted at stage " + run.getAbortedAtIndex()
                    + " (" + run.getAbortedStageId() + "): " + run.getCause().getMessage());
            this.run = run;
        }

        public PipelineRun getRun() {
            return run;
        }
    }
}
