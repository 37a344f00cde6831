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

package org.fireflyframework.dwh.action;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Action source rendering a stored procedure invocation with string literal arguments.
 *
 * <p>With {@code normalizePaths} enabled every argument is treated as a directory path:
 * backslashes become forward slashes and a trailing slash is ensured, so Windows paths
 * can be handed to a warehouse-side {@code COPY}. For example
 * {@code bronze.load_bronze} with {@code C:\data\source_crm} renders as
 * {@code CALL bronze.load_bronze('C:/data/source_crm/');}.</p>
 */
public class ProcedureCallActionSource implements ActionSource {

    private final String procedure;
    private final List<String> arguments;
    private final boolean normalizePaths;

    public ProcedureCallActionSource(String procedure, List<String> arguments) {
        this(procedure, arguments, false);
    }

    public ProcedureCallActionSource(String procedure, List<String> arguments, boolean normalizePaths) {
        this.procedure = Objects.requireNonNull(procedure, "procedure");
        this.arguments = List.copyOf(arguments);
        this.normalizePaths = normalizePaths;
    }

    @Override
    public String resolveCommand() {
        String renderedArguments = arguments.stream()
                .map(argument -> normalizePaths ? normalizePath(argument) : argument)
                .map(ProcedureCallActionSource::quote)
                .collect(Collectors.joining(", "));
        return "CALL " + procedure + "(" + renderedArguments + ");";
    }

    @Override
    public String describe() {
        return "procedure " + procedure;
    }

    static String normalizePath(String path) {
        String normalized = path.replace('\\', '/');
        return normalized.endsWith("/") ? normalized : normalized + "/";
    }

    private static String quote(String value) {
        return "'" + value.replace("'", "''") + "'";
    }
}
