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

import org.fireflyframework.dwh.action.InlineActionSource;
import org.fireflyframework.dwh.quality.AssertionComparator;
import org.fireflyframework.dwh.quality.AssertionSpec;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.fireflyframework.dwh.support.MedallionFixtures.equalsZero;

class StageSpecTest {

    @Test
    void action_shouldPopulateOnlyTheAction() {
        StageSpec stage = StageSpec.action("load_silver", new InlineActionSource("CALL silver.load_silver();"));

        assertThat(stage.getKind()).isEqualTo(StageKind.ACTION);
        assertThat(stage.getAction().resolveCommand()).isEqualTo("CALL silver.load_silver();");
        assertThat(stage.getAssertions()).isEmpty();
    }

    @Test
    void qualityGate_shouldPopulateOnlyTheAssertions() {
        StageSpec stage = StageSpec.qualityGate("gate", List.of(equalsZero("a", "q1"), equalsZero("b", "q2")));

        assertThat(stage.getKind()).isEqualTo(StageKind.QUALITY_GATE);
        assertThat(stage.getAction()).isNull();
        assertThat(stage.getAssertions()).extracting(AssertionSpec::getName).containsExactly("a", "b");
    }

    @Test
    void qualityGate_shouldRejectEmptyGate() {
        assertThatThrownBy(() -> StageSpec.qualityGate("gate", List.of()))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("declares no assertions");
    }

    @Test
    void qualityGate_shouldRejectDuplicateAssertionNamesWithinGate() {
        assertThatThrownBy(() -> StageSpec.qualityGate("gate", List.of(equalsZero("a", "q1"), equalsZero("a", "q2"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("'a' more than once");
    }

    @Test
    void qualityGate_shouldRejectIncompleteAssertion() {
        AssertionSpec noExpected = AssertionSpec.builder()
                .name("a")
                .query("q")
                .comparator(AssertionComparator.EQUALS)
                .build();

        assertThatThrownBy(() -> StageSpec.qualityGate("gate", List.of(noExpected)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("incomplete assertion");
    }

    @Test
    void action_shouldRejectBlankId() {
        assertThatThrownBy(() -> StageSpec.action(" ", new InlineActionSource("x")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
