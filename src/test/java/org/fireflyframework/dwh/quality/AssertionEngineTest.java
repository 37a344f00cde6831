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

import org.fireflyframework.dwh.event.QualityGateEvent;
import org.fireflyframework.dwh.model.FailureKind;
import org.fireflyframework.dwh.query.QueryExecutionException;
import org.fireflyframework.dwh.query.QueryExecutor;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link AssertionEngine}.
 */
@ExtendWith(MockitoExtension.class)
class AssertionEngineTest {

    @Mock
    private QueryExecutor queryExecutor;

    @Mock
    private ApplicationEventPublisher eventPublisher;

    private final AssertionEngine engine = new AssertionEngine();

    private static AssertionSpec assertion(String name, String query, AssertionComparator comparator, String expected) {
        return AssertionSpec.builder()
                .name(name)
                .query(query)
                .comparator(comparator)
                .expected(new BigDecimal(expected))
                .build();
    }

    @Test
    void evaluate_equals_shouldPassWhenActualMatchesExpected() {
        // Given
        AssertionSpec spec = assertion("no duplicates", "q", AssertionComparator.EQUALS, "0");
        when(queryExecutor.queryScalar("q")).thenReturn(Mono.just(BigDecimal.ZERO));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.PASSED);
                    assertThat(outcome.getActual()).isEqualByComparingTo("0");
                    assertThat(outcome.getReason()).isNull();
                    assertThat(outcome.getFailureKind()).isNull();
                })
                .verifyComplete();
    }

    @Test
    void evaluate_equals_shouldFailWithExpectedAndActualInReason() {
        // Given
        AssertionSpec spec = assertion("no duplicates", "q", AssertionComparator.EQUALS, "0");
        when(queryExecutor.queryScalar("q")).thenReturn(Mono.just(new BigDecimal("3")));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.FAILED);
                    assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.ASSERTION_FAILURE);
                    assertThat(outcome.getReason()).isEqualTo("no duplicates: expected 0, got 3");
                    assertThat(outcome.getComparator()).isEqualTo(AssertionComparator.EQUALS);
                    assertThat(outcome.getExpected()).isEqualByComparingTo("0");
                    assertThat(outcome.getActual()).isEqualByComparingTo("3");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_greaterOrEqual_shouldPassAtThreshold() {
        // Given - 95.0 vs 95.0, scale differences do not matter
        AssertionSpec spec = assertion("completeness", "q", AssertionComparator.GREATER_OR_EQUAL, "95.0");
        when(queryExecutor.queryScalar("q")).thenReturn(Mono.just(new BigDecimal("95.00")));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> assertThat(outcome.isPassed()).isTrue())
                .verifyComplete();
    }

    @Test
    void evaluate_greaterOrEqual_shouldFailJustBelowThreshold() {
        // Given
        AssertionSpec spec = assertion("completeness", "q", AssertionComparator.GREATER_OR_EQUAL, "95.0");
        when(queryExecutor.queryScalar("q")).thenReturn(Mono.just(new BigDecimal("94.99")));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.FAILED);
                    assertThat(outcome.getReason()).isEqualTo("completeness: expected >= 95, got 94.99");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_lessOrEqual_shouldCompareAgainstUpperBound() {
        // Given
        AssertionSpec spec = assertion("late rows", "q", AssertionComparator.LESS_OR_EQUAL, "10");
        when(queryExecutor.queryScalar("q"))
                .thenReturn(Mono.just(new BigDecimal("10")))
                .thenReturn(Mono.just(new BigDecimal("11")));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> assertThat(outcome.isPassed()).isTrue())
                .verifyComplete();
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> assertThat(outcome.getReason()).isEqualTo("late rows: expected <= 10, got 11"))
                .verifyComplete();
    }

    @Test
    void evaluate_shouldReportMissingResultWhenQueryReturnsNoValue() {
        // Given - no row is never treated as 0
        AssertionSpec spec = assertion("no duplicates", "q", AssertionComparator.EQUALS, "0");
        when(queryExecutor.queryScalar("q")).thenReturn(Mono.empty());

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.FAILED);
                    assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.MISSING_RESULT);
                    assertThat(outcome.getActual()).isNull();
                    assertThat(outcome.getReason()).isEqualTo("no duplicates: query returned no value");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldReportErrorWhenQueryFails() {
        // Given
        AssertionSpec spec = assertion("no duplicates", "q", AssertionComparator.EQUALS, "0");
        when(queryExecutor.queryScalar("q"))
                .thenReturn(Mono.error(new QueryExecutionException("relation \"silver.crm_cust_info\" does not exist")));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.ERROR);
                    assertThat(outcome.getFailureKind()).isEqualTo(FailureKind.QUERY_EXECUTION_ERROR);
                    assertThat(outcome.getReason())
                            .startsWith("no duplicates: ")
                            .contains("relation \"silver.crm_cust_info\" does not exist");
                })
                .verifyComplete();
    }

    @Test
    void evaluate_shouldReportErrorWhenExecutorThrows() {
        // Given
        AssertionSpec spec = assertion("no duplicates", "q", AssertionComparator.EQUALS, "0");
        when(queryExecutor.queryScalar("q")).thenThrow(new IllegalStateException("connection closed"));

        // When & Then
        StepVerifier.create(engine.evaluate(spec, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getStatus()).isEqualTo(AssertionStatus.ERROR);
                    assertThat(outcome.getReason()).contains("connection closed");
                })
                .verifyComplete();
    }

    @Test
    void evaluateGate_failFast_shouldStopAtFirstFailureAndMarkRestNotRun() {
        // Given - the third query is never stubbed because it must never run
        List<AssertionSpec> gate = List.of(
                assertion("first", "q1", AssertionComparator.EQUALS, "0"),
                assertion("second", "q2", AssertionComparator.EQUALS, "0"),
                assertion("third", "q3", AssertionComparator.EQUALS, "0"));
        when(queryExecutor.queryScalar("q1")).thenReturn(Mono.just(BigDecimal.ZERO));
        when(queryExecutor.queryScalar("q2")).thenReturn(Mono.just(new BigDecimal("2")));

        // When & Then
        StepVerifier.create(engine.evaluateGate(gate, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.isPassed()).isFalse();
                    assertThat(outcome.getStrategy()).isEqualTo(QualityStrategy.FAIL_FAST);
                    assertThat(outcome.getOutcomes())
                            .extracting(AssertionOutcome::getStatus)
                            .containsExactly(AssertionStatus.PASSED, AssertionStatus.FAILED, AssertionStatus.NOT_RUN);
                    assertThat(outcome.getFirstFailure().getName()).isEqualTo("second");
                    assertThat(outcome.getPassedCount()).isEqualTo(1);
                    assertThat(outcome.getFailedCount()).isEqualTo(1);
                    assertThat(outcome.getNotRunCount()).isEqualTo(1);
                })
                .verifyComplete();

        verify(queryExecutor, never()).queryScalar("q3");
    }

    @Test
    void evaluateGate_failFast_shouldStopOnErrorToo() {
        // Given
        List<AssertionSpec> gate = List.of(
                assertion("first", "q1", AssertionComparator.EQUALS, "0"),
                assertion("second", "q2", AssertionComparator.EQUALS, "0"));
        when(queryExecutor.queryScalar("q1")).thenReturn(Mono.error(new QueryExecutionException("syntax error")));

        // When & Then
        StepVerifier.create(engine.evaluateGate(gate, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.getFirstFailure().getStatus()).isEqualTo(AssertionStatus.ERROR);
                    assertThat(outcome.getOutcomes().get(1).getStatus()).isEqualTo(AssertionStatus.NOT_RUN);
                    assertThat(outcome.getOutcomes().get(1).getActual()).isNull();
                })
                .verifyComplete();

        verify(queryExecutor, never()).queryScalar("q2");
    }

    @Test
    void evaluateGate_collectAll_shouldRunEveryAssertionAndReportFirstFailure() {
        // Given
        List<AssertionSpec> gate = List.of(
                assertion("first", "q1", AssertionComparator.EQUALS, "0"),
                assertion("second", "q2", AssertionComparator.EQUALS, "0"),
                assertion("third", "q3", AssertionComparator.EQUALS, "0"));
        when(queryExecutor.queryScalar("q1")).thenReturn(Mono.just(new BigDecimal("4")));
        when(queryExecutor.queryScalar("q2")).thenReturn(Mono.empty());
        when(queryExecutor.queryScalar("q3")).thenReturn(Mono.just(BigDecimal.ZERO));

        // When & Then
        StepVerifier.create(engine.evaluateGate(gate, queryExecutor, QualityStrategy.COLLECT_ALL))
                .assertNext(outcome -> {
                    assertThat(outcome.isPassed()).isFalse();
                    assertThat(outcome.getOutcomes())
                            .extracting(AssertionOutcome::getStatus)
                            .containsExactly(AssertionStatus.FAILED, AssertionStatus.FAILED, AssertionStatus.PASSED);
                    assertThat(outcome.getFirstFailure().getReason()).isEqualTo("first: expected 0, got 4");
                    assertThat(outcome.getFailures()).hasSize(2);
                    assertThat(outcome.getNotRunCount()).isZero();
                })
                .verifyComplete();
    }

    @Test
    void evaluateGate_shouldRunAssertionsInDeclaredOrder() {
        // Given
        List<AssertionSpec> gate = List.of(
                assertion("first", "q1", AssertionComparator.EQUALS, "0"),
                assertion("second", "q2", AssertionComparator.EQUALS, "0"),
                assertion("third", "q3", AssertionComparator.EQUALS, "0"));
        when(queryExecutor.queryScalar("q1")).thenReturn(Mono.just(BigDecimal.ZERO));
        when(queryExecutor.queryScalar("q2")).thenReturn(Mono.just(BigDecimal.ZERO));
        when(queryExecutor.queryScalar("q3")).thenReturn(Mono.just(BigDecimal.ZERO));

        // When & Then
        StepVerifier.create(engine.evaluateGate(gate, queryExecutor))
                .assertNext(outcome -> {
                    assertThat(outcome.isPassed()).isTrue();
                    assertThat(outcome.getPassedCount()).isEqualTo(3);
                    assertThat(outcome.getFirstFailure()).isNull();
                    assertThat(outcome.getFailures()).isEmpty();
                })
                .verifyComplete();

        InOrder order = inOrder(queryExecutor);
        order.verify(queryExecutor).queryScalar("q1");
        order.verify(queryExecutor).queryScalar("q2");
        order.verify(queryExecutor).queryScalar("q3");
    }

    @Test
    void evaluateGate_shouldPublishEvent() {
        // Given
        AssertionEngine publishingEngine = new AssertionEngine(QualityStrategy.FAIL_FAST, eventPublisher);
        List<AssertionSpec> gate = List.of(assertion("first", "q1", AssertionComparator.EQUALS, "0"));
        when(queryExecutor.queryScalar("q1")).thenReturn(Mono.just(BigDecimal.ZERO));

        // When
        StepVerifier.create(publishingEngine.evaluateGate(gate, queryExecutor))
                .assertNext(outcome -> assertThat(outcome.isPassed()).isTrue())
                .verifyComplete();

        // Then
        ArgumentCaptor<QualityGateEvent> captor = ArgumentCaptor.forClass(QualityGateEvent.class);
        verify(eventPublisher).publishEvent(captor.capture());

        QualityGateEvent event = captor.getValue();
        assertThat(event.getOutcome().isPassed()).isTrue();
        assertThat(event.getTimestamp()).isNotNull();
    }
}
