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

package org.fireflyframework.dwh.query;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.jdbc.core.StatementCallback;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;
import java.util.concurrent.TimeoutException;

/**
 * {@link QueryExecutor} backed by Spring's {@link JdbcTemplate}.
 *
 * <p>Blocking JDBC calls are moved to the bounded elastic scheduler. Spring's
 * {@link DataAccessException}s are translated into {@link QueryExecutionException}
 * carrying the most specific driver message, so operators see the database's own words.</p>
 *
 * <p>When a timeout is configured it is set on each {@link Statement} (rounded up to whole
 * seconds), so the database cancels the work itself. The same timeout is also enforced on
 * the reactive side: when it elapses first, the running statement is cancelled through
 * {@link Statement#cancel()} before the call fails with a {@link QueryExecutionException}.
 * No retry is attempted.</p>
 */
@Slf4j
public class JdbcQueryExecutor implements QueryExecutor {

    private static final ResultSetExtractor<Object> FIRST_COLUMN_OF_FIRST_ROW =
            rs -> rs.next() ? rs.getObject(1) : null;

    private final JdbcTemplate jdbcTemplate;
    private final Duration timeout;

    /**
     * Creates an executor without a per-call timeout.
     *
     * @param jdbcTemplate the template bound to the warehouse data source
     */
    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate) {
        this(jdbcTemplate, null);
    }

    /**
     * Creates an executor with an optional per-call timeout.
     *
     * @param jdbcTemplate the template bound to the warehouse data source
     * @param timeout      the per-call timeout, or {@code null} to wait indefinitely
     */
    public JdbcQueryExecutor(JdbcTemplate jdbcTemplate, Duration timeout) {
        this.jdbcTemplate = jdbcTemplate;
        this.timeout = timeout;
    }

    @Override
    public Mono<Void> execute(String command) {
        return Mono.defer(() -> {
            RunningStatement running = new RunningStatement();
            Mono<Void> call = Mono.<Void>fromRunnable(() -> runCommand(command, running))
                    .subscribeOn(Schedulers.boundedElastic());
            return withTimeout(call, running);
        });
    }

    @Override
    public Mono<BigDecimal> queryScalar(String sql) {
        return Mono.defer(() -> {
            RunningStatement running = new RunningStatement();
            Mono<BigDecimal> call = Mono.fromCallable(() -> readScalar(sql, running))
                    .subscribeOn(Schedulers.boundedElastic());
            return withTimeout(call, running);
        });
    }

    private void runCommand(String command, RunningStatement running) {
        log.debug("Executing warehouse command ({} chars)", command.length());
        try {
            jdbcTemplate.execute((StatementCallback<Void>) statement -> {
                prepare(statement, running);
                statement.execute(command);
                return null;
            });
        } catch (DataAccessException e) {
            throw translate(e);
        } finally {
            running.finish();
        }
    }

    private BigDecimal readScalar(String sql, RunningStatement running) {
        Object value;
        try {
            value = jdbcTemplate.execute((StatementCallback<Object>) statement -> {
                prepare(statement, running);
                try (ResultSet rs = statement.executeQuery(sql)) {
                    return FIRST_COLUMN_OF_FIRST_ROW.extractData(rs);
                }
            });
        } catch (DataAccessException e) {
            throw translate(e);
        } finally {
            running.finish();
        }
        // null makes fromCallable complete empty
        return toDecimal(value);
    }

    private void prepare(Statement statement, RunningStatement running) throws SQLException {
        if (timeout != null) {
            statement.setQueryTimeout(timeoutSeconds(timeout));
        }
        running.start(statement);
    }

    private QueryExecutionException translate(DataAccessException e) {
        if (e instanceof QueryTimeoutException && timeout != null) {
            return new QueryExecutionException(timeoutMessage(), e);
        }
        return new QueryExecutionException(e.getMostSpecificCause().getMessage(), e);
    }

    private <T> Mono<T> withTimeout(Mono<T> call, RunningStatement running) {
        if (timeout == null) {
            return call;
        }
        return call.doOnCancel(running::cancel)
                .timeout(timeout)
                .onErrorMap(TimeoutException.class, e -> new QueryExecutionException(timeoutMessage(), e));
    }

    private String timeoutMessage() {
        return "warehouse call timed out after " + timeout.toMillis() + "ms";
    }

    /**
     * JDBC timeouts are whole seconds; anything below one second rounds up to one.
     */
    static int timeoutSeconds(Duration timeout) {
        long millis = timeout.toMillis();
        return (int) Math.max(1, (millis + 999) / 1000);
    }

    static BigDecimal toDecimal(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (value instanceof Number number) {
            try {
                return new BigDecimal(number.toString());
            } catch (NumberFormatException e) {
                throw new QueryExecutionException("query returned a non-finite number: " + number, e);
            }
        }
        throw new QueryExecutionException("query returned a non-numeric value of type "
                + value.getClass().getSimpleName() + ": " + value);
    }

    /**
     * Tracks the statement of one call so a timeout on another thread can cancel it.
     * A call cancelled before its statement starts is refused instead of executed.
     */
    private final class RunningStatement {

        private Statement statement;
        private boolean cancelled;

        synchronized void start(Statement statement) throws SQLException {
            if (cancelled) {
                throw new SQLException("warehouse call cancelled before it started");
            }
            this.statement = statement;
        }

        synchronized void finish() {
            statement = null;
        }

        synchronized void cancel() {
            cancelled = true;
            if (statement == null) {
                return;
            }
            try {
                statement.cancel();
                log.warn("Cancelled warehouse statement after {}ms timeout", timeout.toMillis());
            } catch (SQLException e) {
                log.warn("Failed to cancel warehouse statement after timeout: {}", e.getMessage());
            }
        }
    }
}
