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

import java.math.BigDecimal;

/**
 * Comparison applied between an assertion's actual scalar and its expected value.
 *
 * <p>Comparisons use {@link BigDecimal#compareTo(BigDecimal)}, so {@code 95.0} equals {@code 95.00}.</p>
 */
public enum AssertionComparator {

    EQUALS("", "==") {
        @Override
        public boolean test(BigDecimal actual, BigDecimal expected) {
            return actual.compareTo(expected) == 0;
        }
    },
    GREATER_OR_EQUAL(">= ", ">=") {
        @Override
        public boolean test(BigDecimal actual, BigDecimal expected) {
            return actual.compareTo(expected) >= 0;
        }
    },
    LESS_OR_EQUAL("<= ", "<=") {
        @Override
        public boolean test(BigDecimal actual, BigDecimal expected) {
            return actual.compareTo(expected) <= 0;
        }
    };

    private final String expectationPrefix;
    private final String symbol;

    AssertionComparator(String expectationPrefix, String symbol) {
        this.expectationPrefix = expectationPrefix;
        this.symbol = symbol;
    }

    /**
     * Returns whether {@code actual} satisfies this comparator against {@code expected}.
     *
     * @param actual   the value returned by the assertion query
     * @param expected the declared expected value or threshold
     * @return {@code true} if the assertion holds
     */
    public abstract boolean test(BigDecimal actual, BigDecimal expected);

    /**
     * Renders the expectation part of a failure reason, e.g. {@code "0"} or {@code ">= 95"}.
     *
     * @param expected the expected value
     * @return the rendered expectation
     */
    public String describeExpectation(BigDecimal expected) {
        return expectationPrefix + plain(expected);
    }

    public String getSymbol() {
        return symbol;
    }

    static String plain(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }
}
