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

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.Objects;

/**
 * Action source reading a SQL script from a Spring {@link Resource}
 * ({@code classpath:}, {@code file:} or any other supported location).
 *
 * <p>The script is read as UTF-8 each time the stage runs.</p>
 */
@Slf4j
public class ScriptResourceActionSource implements ActionSource {

    private final Resource script;

    public ScriptResourceActionSource(Resource script) {
        this.script = Objects.requireNonNull(script, "script");
    }

    @Override
    public String resolveCommand() {
        if (!script.exists()) {
            throw new ActionSourceException("script not found at " + script.getDescription());
        }
        try (InputStream in = script.getInputStream()) {
            String body = StreamUtils.copyToString(in, StandardCharsets.UTF_8);
            log.debug("Loaded script {} ({} chars)", script.getDescription(), body.length());
            return body;
        } catch (IOException e) {
            throw new ActionSourceException("failed to read script " + script.getDescription()
                    + ": " + e.getMessage(), e);
        }
    }

    @Override
    public String describe() {
        return "script " + script.getDescription();
    }
}
