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

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.core.io.FileSystemResource;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for {@link ScriptResourceActionSource}.
 */
class ScriptResourceActionSourceTest {

    @TempDir
    Path tempDir;

    @Test
    void resolveCommand_shouldReadScriptFromFile() throws IOException {
        // Given
        Path script = tempDir.resolve("ddl_gold.sql");
        Files.writeString(script, "CREATE VIEW gold_customers AS SELECT * FROM silver_customers;",
                StandardCharsets.UTF_8);
        ScriptResourceActionSource source = new ScriptResourceActionSource(new FileSystemResource(script));

        // When & Then
        assertThat(source.resolveCommand())
                .isEqualTo("CREATE VIEW gold_customers AS SELECT * FROM silver_customers;");
        assertThat(source.describe()).startsWith("script ").contains("ddl_gold.sql");
    }

    @Test
    void resolveCommand_shouldReadUtf8Content() {
        ScriptResourceActionSource source = new ScriptResourceActionSource(
                new ByteArrayResource("SELECT 'Müller';".getBytes(StandardCharsets.UTF_8)));

        assertThat(source.resolveCommand()).isEqualTo("SELECT 'Müller';");
    }

    @Test
    void resolveCommand_shouldFailWhenScriptIsMissing() {
        // Given
        ScriptResourceActionSource source = new ScriptResourceActionSource(
                new FileSystemResource(tempDir.resolve("missing.sql")));

        // When & Then
        assertThatThrownBy(source::resolveCommand)
                .isInstanceOf(ActionSourceException.class)
                .hasMessageStartingWith("script not found at ")
                .hasMessageContaining("missing.sql");
    }
}
