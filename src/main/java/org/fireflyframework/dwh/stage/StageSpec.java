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

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;
import org.fireflyframework.dwh.action.ActionSource;
import org.fireflyframework.dwh.quality.AssertionSpec;

import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable declaration of one pipeline stage.
 *
 * <p>Exactly one of {@link #getAction()} and {@link #getAssertions()} is populated, matching
 * {@link #getKind()}. Instances are created through {@link #action(String, ActionSource)} and
 * {@link #qualityGate(String, List)}, which enforce that invariant.</p>
 */
@Getter
@ToString
@EqualsAndHashCode
public final class StageSpec {

    private final String id;
    private final StageKind kind;
    private final ActionSource action;
    private final List<AssertionSpec> assertions;

    private StageSpec(String id, StageKind kind, ActionSource action, List<AssertionSpec> assertions) {
        this.id = id;
        this.kind = kind;
        this.action = action;
        this.assertions = assertions;
    }

    /**
     * Declares an action stage.
     *
     * @param id     the stage identifier
     * @param action the source of the command to execute
     * @return the stage declaration
     */
    public static StageSpec action(String id, ActionSource action) {
        requireId(id);
        Objects.requireNonNull(action, "action");
        return new StageSpec(id, StageKind.ACTION, action, List.of());
    }

    /**
     * Declares a quality gate stage.
     *
     * @param id         the stage identifier
     * @param assertions the assertions in evaluation order; at least one, names unique within the gate
     * @return the stage declaration
     * @throws IllegalArgumentException if the gate is empty, an assertion is incomplete,
     *                                  or two assertions share a name
     */
    public static StageSpec qualityGate(String id, List<AssertionSpec> assertions) {
        requireId(id);
        Objects.requireNonNull(assertions, "assertions");
        if (assertions.isEmpty()) {
            throw new IllegalArgumentException("quality gate '" + id + "' declares no assertions");
        }
        Set<String> names = new HashSet<>();
        for (AssertionSpec assertion : assertions) {
            if (assertion.getName() == null || assertion.getName().isBlank()
                    || assertion.getQuery() == null || assertion.getQuery().isBlank()
                    || assertion.getComparator() == null || assertion.getExpected() == null) {
                throw new IllegalArgumentException("quality gate '" + id
                        + "' has an incomplete assertion: " + assertion);
            }
            if (!names.add(assertion.getName())) {
                throw new IllegalArgumentException("quality gate '" + id
                        + "' declares assertion '" + assertion.getName() + "' more than once");
            }
        }
        return new StageSpec(id, StageKind.QUALITY_GATE, null, List.copyOf(assertions));
    }

    private static void requireId(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("stage id must not be blank");
        }
    }
}
