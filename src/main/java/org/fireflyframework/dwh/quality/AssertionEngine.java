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

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.event.QualityGateEvent;
import org.fireflyframework.dwh.model.FailureKind;
import org.fireflyframework.dwh.query.QueryExecutor;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Engine that evaluates {@link AssertionSpec}s against the warehouse through a {@link QueryExecutor}.
 *
 * <p>A single assertion resolves to one of three results:</p>
 * <ul>
 *   <li>the executor errors - {@link AssertionStatus#ERROR} ({@link FailureKind#QUERY_EXECUTION_ERROR})</li>
 *   <li>the executor returns no value - {@link AssertionStatus#FAILED} ({@link FailureKind#MISSING_RESULT})</li>
 *   <li>otherwise the comparator decides between {@link AssertionStatus#PASSED} and
 *       {@link AssertionStatus#FAILED} ({@link FailureKind#ASSERTION_FAILURE})</li>
 * </ul>
 *
 * <p>Gates run their assertions one after another in declared order using the
 * configured {@link QualityStrategy}. When an {@link ApplicationEventPublisher} is provided,
 * a {@link QualityGateEvent} is published after each gate.</p>
 */
@Slf4j
public class AssertionEngine {

    private final QualityStrategy defaultStrategy;
    private final ApplicationEventPublisher eventPublisher;

    /**
     * Creates a fail-fast engine without event publishing.
     */
    public AssertionEngine() {
        this(QualityStrategy.FAIL_FAST, null);
    }

    /**
     * Creates an engine with the given gate strategy and optional event publisher.
     *
     * @param defaultStrategy the strategy used by {@link #evaluateGate(List, QueryExecutor)}
     * @param eventPublisher  the event publisher, or {@code null} to disable event publishing
     */
    public AssertionEngine(QualityStrategy defaultStrategy, ApplicationEventPublisher eventPublisher) {
        this.defaultStrategy = defaultStrategy;
        this.eventPublisher = eventPublisher;
    }

    /**
     * Evaluates one assertion. The returned {@link Mono} never errors: executor failures
     * become {@link AssertionStatus#ERROR} outcomes.
     *
     * @param assertion     the assertion to evaluate
     * @param queryExecutor the executor used to run the assertion query
     * @return a {@link Mono} emitting the outcome
     */
    public Mono<AssertionOutcome> evaluate(AssertionSpec assertion, QueryExecutor queryExecutor) {
        return Mono.defer(() -> {
            long startNanos = System.nanoTime();
            log.debug("Running assertion '{}'", assertion.getName());

            return Mono.defer(() -> queryExecutor.queryScalar(assertion.getQuery()))
                    .map(actual -> compare(assertion, actual, elapsedMs(startNanos)))
                    .switchIfEmpty(Mono.fromSupplier(() -> missing(assertion, elapsedMs(startNanos))))
                    .onErrorResume(error -> Mono.just(errored(assertion, error, elapsedMs(startNanos))))
                    .doOnNext(this::logOutcome);
        });
    }

    /**
     * Evaluates a gate with the engine's default strategy.
     *
     * @param assertions    the assertions in declared order
     * @param queryExecutor the executor used to run the assertion queries
     * @return a {@link Mono} emitting the gate outcome
     */
    public Mono<GateOutcome> evaluateGate(List<AssertionSpec> assertions, QueryExecutor queryExecutor) {
        return evaluateGate(assertions, queryExecutor, defaultStrategy);
    }

    /**
     * Evaluates a gate in declared order. Under {@link QualityStrategy#FAIL_FAST} no assertion
     * after the first failure is subscribed to; those assertions are reported as
     * {@link AssertionStatus#NOT_RUN}.
     *
     * @param assertions    the assertions in declared order
     * @param queryExecutor the executor used to run the assertion queries
     * @param strategy      the evaluation strategy
     * @return a {@link Mono} emitting the gate outcome
     */
    public Mono<GateOutcome> evaluateGate(List<AssertionSpec> assertions, QueryExecutor queryExecutor,
                                          QualityStrategy strategy) {
        Flux<AssertionOutcome> executed = Flux.fromIterable(assertions)
                .concatMap(assertion -> evaluate(assertion, queryExecutor));

        if (strategy == QualityStrategy.FAIL_FAST) {
            executed = executed.takeUntil(AssertionOutcome::isFailure);
        }

        return executed.collectList()
                .map(outcomes -> buildGateOutcome(assertions, outcomes, strategy))
                .doOnNext(this::publishEvent);
    }

    private AssertionOutcome compare(AssertionSpec assertion, BigDecimal actual, long durationMs) {
        AssertionComparator comparator = assertion.getComparator();
        if (comparator.test(actual, assertion.getExpected())) {
            return outcome(assertion, actual, durationMs)
                    .status(AssertionStatus.PASSED)
                    .build();
        }
        String reason = assertion.getName() + ": expected "
                + comparator.describeExpectation(assertion.getExpected())
                + ", got " + AssertionComparator.plain(actual);
        return outcome(assertion, actual, durationMs)
                .status(AssertionStatus.FAILED)
                .failureKind(FailureKind.ASSERTION_FAILURE)
                .reason(reason)
                .build();
    }

    private AssertionOutcome missing(AssertionSpec assertion, long durationMs) {
        return outcome(assertion, null, durationMs)
                .status(AssertionStatus.FAILED)
                .failureKind(FailureKind.MISSING_RESULT)
                .reason(assertion.getName() + ": query returned no value")
                .build();
    }

    private AssertionOutcome errored(AssertionSpec assertion, Throwable error, long durationMs) {
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return outcome(assertion, null, durationMs)
                .status(AssertionStatus.ERROR)
                .failureKind(FailureKind.QUERY_EXECUTION_ERROR)
                .reason(assertion.getName() + ": query failed: " + message)
                .build();
    }

    private AssertionOutcome.AssertionOutcomeBuilder outcome(AssertionSpec assertion, BigDecimal actual,
                                                             long durationMs) {
        return AssertionOutcome.builder()
                .name(assertion.getName())
                .comparator(assertion.getComparator())
                .expected(assertion.getExpected())
                .actual(actual)
                .durationMs(durationMs);
    }

    private GateOutcome buildGateOutcome(List<AssertionSpec> assertions, List<AssertionOutcome> executed,
                                         QualityStrategy strategy) {
        List<AssertionOutcome> outcomes = new ArrayList<>(executed);
        for (int i = executed.size(); i < assertions.size(); i++) {
            outcomes.add(AssertionOutcome.notRun(assertions.get(i)));
        }

        int passedCount = 0;
        int failedCount = 0;
        int notRunCount = 0;
        AssertionOutcome firstFailure = null;

        for (AssertionOutcome outcome : outcomes) {
            if (outcome.isPassed()) {
                passedCount++;
            } else if (outcome.isFailure()) {
                failedCount++;
                if (firstFailure == null) {
                    firstFailure = outcome;
                }
            } else {
                notRunCount++;
            }
        }

        return GateOutcome.builder()
                .passed(firstFailure == null)
                .strategy(strategy)
                .outcomes(List.copyOf(outcomes))
                .firstFailure(firstFailure)
                .passedCount(passedCount)
                .failedCount(failedCount)
                .notRunCount(notRunCount)
                .evaluatedAt(Instant.now())
                .build();
    }

    private void logOutcome(AssertionOutcome outcome) {
        if (outcome.isPassed()) {
            log.debug("Assertion '{}' passed: {} {} {}", outcome.getName(),
                    outcome.getActual(), outcome.getComparator().getSymbol(), outcome.getExpected());
        } else {
            log.warn("Assertion {}: {}", outcome.getStatus(), outcome.getReason());
        }
    }

    private void publishEvent(GateOutcome outcome) {
        if (eventPublisher != null) {
            eventPublisher.publishEvent(new QualityGateEvent(outcome));
        }
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
