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

package org.fireflyframework.dwh.config;

import lombok.extern.slf4j.Slf4j;
import org.fireflyframework.dwh.pipeline.PipelineDefinition;
import org.fireflyframework.dwh.pipeline.PipelineExecutor;
import org.fireflyframework.dwh.quality.AssertionEngine;
import org.fireflyframework.dwh.query.JdbcQueryExecutor;
import org.fireflyframework.dwh.query.QueryExecutor;
import org.fireflyframework.dwh.report.RunReportRenderer;
import org.fireflyframework.dwh.stage.StageRunner;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.annotation.Bean;
import org.springframework.core.io.ResourceLoader;
import org.springframework.jdbc.core.JdbcTemplate;

/**
 * Auto-configuration for the quality-gated warehouse pipeline.
 *
 * <p>This configuration automatically sets up:</p>
 * <ul>
 *   <li>a {@link JdbcQueryExecutor} when a {@link JdbcTemplate} is available and no other
 *       {@link QueryExecutor} is defined</li>
 *   <li>the {@link AssertionEngine} and {@link StageRunner}</li>
 *   <li>the {@link PipelineExecutor} once a {@link QueryExecutor} is available; without one
 *       neither the executor nor the startup runner is created</li>
 *   <li>the {@link PipelineDefinition} built from {@code firefly.dwh.pipeline.stages}</li>
 *   <li>a {@link PipelineStartupRunner} when {@code firefly.dwh.pipeline.run-on-startup} is true</li>
 * </ul>
 *
 * <p>The configuration is activated when {@code firefly.dwh.pipeline.enabled} is true (default).</p>
 */
@Slf4j
@AutoConfiguration(after = JdbcTemplateAutoConfiguration.class)
@EnableConfigurationProperties(PipelineProperties.class)
@ConditionalOnProperty(
    prefix = "firefly.dwh.pipeline",
    name = "enabled",
    havingValue = "true",
    matchIfMissing = true
)
public class PipelineAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(JdbcTemplate.class)
    public QueryExecutor queryExecutor(JdbcTemplate jdbcTemplate, PipelineProperties properties) {
        log.info("Configuring JDBC query executor (timeout: {})",
                properties.getQueryTimeout() != null ? properties.getQueryTimeout() : "none");
        return new JdbcQueryExecutor(jdbcTemplate, properties.getQueryTimeout());
    }

    @Bean
    @ConditionalOnMissingBean
    public AssertionEngine assertionEngine(
            PipelineProperties properties,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        log.info("Configuring assertion engine with {} quality gate strategy", properties.getStrategy());
        return new AssertionEngine(properties.getStrategy(), eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public StageRunner stageRunner(AssertionEngine assertionEngine) {
        return new StageRunner(assertionEngine);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineDefinitionFactory pipelineDefinitionFactory(ResourceLoader resourceLoader) {
        return new PipelineDefinitionFactory(resourceLoader);
    }

    @Bean
    @ConditionalOnMissingBean
    public PipelineDefinition pipelineDefinition(PipelineDefinitionFactory factory, PipelineProperties properties) {
        return factory.create(properties);
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnBean(QueryExecutor.class)
    public PipelineExecutor pipelineExecutor(
            QueryExecutor queryExecutor,
            StageRunner stageRunner,
            @Autowired(required = false) ApplicationEventPublisher eventPublisher) {
        return new PipelineExecutor(queryExecutor, stageRunner, eventPublisher);
    }

    @Bean
    @ConditionalOnMissingBean
    public RunReportRenderer runReportRenderer() {
        return new RunReportRenderer();
    }

    @Bean
    @ConditionalOnBean(PipelineExecutor.class)
    @ConditionalOnProperty(prefix = "firefly.dwh.pipeline", name = "run-on-startup", havingValue = "true")
    public PipelineStartupRunner pipelineStartupRunner(PipelineExecutor executor, PipelineDefinition definition,
                                                       RunReportRenderer renderer) {
        log.info("Pipeline '{}' will run on startup", definition.getName());
        return new PipelineStartupRunner(executor, definition, renderer);
    }
}
