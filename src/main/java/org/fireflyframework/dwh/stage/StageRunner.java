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

package org.fireflyframework.dwh.stage;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.action.ActionSourceException;
import org.fireflyframework.dwh.model.FailureCause;
import org.fireflyframework.dwh.model.FailureKind;
import org.fireflyframework.dwh.quality.AssertionEngine;
import org.fireflyframework.dwh.quality.AssertionOutcome;
import org.fireflyframework.dwh.quality.GateOutcome;
import org.fireflyframework.dwh.query.QueryExecutor;
import reactor.core.publisher.Mono;

import java.util.concurrent.TimeUnit;

/**
 * Runs a single {@link StageSpec} and converts whatever happens into a {@link StageResult}.
 *
 * <p>This is the failure boundary of the pipeline: errors raised by the action source or the
 * query executor are caught here and turned into a {@link StageStatus#FAILED} result whose
 * reason is the underlying message, verbatim. The returned {@link Mono} never errors.</p>
 */
@Slf4j
public class StageRunner {

    private final AssertionEngine assertionEngine;

    public StageRunner(AssertionEngine assertionEngine) {
        this.assertionEngine = assertionEngine;
    }

    /**
     * Runs the stage against the given executor.
     *
     * @param stage         the stage to run
     * @param queryExecutor the warehouse executor
     * @return a {@link Mono} emitting a {@link StageStatus#SUCCEEDED} or {@link StageStatus#FAILED} result
     */
    public Mono<StageResult> run(StageSpec stage, QueryExecutor queryExecutor) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            Mono<StageResult> execution = stage.getKind() == StageKind.ACTION
                    ? runAction(stage, queryExecutor)
                    : runQualityGate(stage, queryExecutor);

            return execution
                    .onErrorResume(error -> Mono.just(failed(stage,
                            FailureCause.of(FailureKind.QUERY_EXECUTION_ERROR, stage.getId(), messageOf(error)),
                            null)))
                    .map(result -> result.toBuilder()
                            .durationMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos))
                            .build());
        });
    }

    private Mono<StageResult> runAction(StageSpec stage, QueryExecutor queryExecutor) {
        return Mono.fromCallable(() -> stage.getAction().resolveCommand())
                .switchIfEmpty(Mono.error(() -> new ActionSourceException(
                        "action source returned no command for stage '" + stage.getId() + "'")))
                .doOnNext(command -> log.debug("Stage '{}' executing {}", stage.getId(), stage.getAction().describe()))
                .flatMap(command -> Mono.defer(() -> queryExecutor.execute(command)))
                .then(Mono.fromSupplier(() -> succeeded(stage, null)));
    }

    private Mono<StageResult> runQualityGate(StageSpec stage, QueryExecutor queryExecutor) {
        return assertionEngine.evaluateGate(stage.getAssertions(), queryExecutor)
                .map(gate -> gate.isPassed() ? succeeded(stage, gate) : failed(stage, causeOf(stage, gate), gate));
    }

    private static FailureCause causeOf(StageSpec stage, GateOutcome gate) {
        AssertionOutcome failure = gate.getFirstFailure();
        return FailureCause.builder()
                .kind(failure.getFailureKind())
                .stageId(stage.getId())
                .assertionName(failure.getName())
                .message(failure.getReason())
                .build();
    }

    private static StageResult succeeded(StageSpec stage, GateOutcome gate) {
        return StageResult.builder()
                .stageId(stage.getId())
                .kind(stage.getKind())
                .status(StageStatus.SUCCEEDED)
                .gate(gate)
                .build();
    }

    private static StageResult failed(StageSpec stage, FailureCause cause, GateOutcome gate) {
        return StageResult.builder()
                .stageId(stage.getId())
                .kind(stage.getKind())
                .status(StageStatus.FAILED)
                .cause(cause)
                .gate(gate)
                .build();
    }

    private static String messageOf(Throwable error) {
        return error.getMessage() != null ? error.getMessage() : error.getClass().getName();
    }
}
