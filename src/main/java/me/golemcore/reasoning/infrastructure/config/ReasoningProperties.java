/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

package me.golemcore.reasoning.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.EnumMap;
import java.util.Map;

import me.golemcore.reasoning.domain.graph.DeploymentMode;
import me.golemcore.reasoning.domain.model.ArtifactKind;

/**
 * Configuration of the reasoning core, bound from application.properties under
 * the {@code reasoning.*} prefix.
 *
 * <ul>
 * <li>{@link SessionProperties} - idle timeout, per-kind capacity, graph
 * mode</li>
 * <li>{@link StorageProperties} - local workspace location</li>
 * <li>{@link PersistenceProperties} - unified store snapshot files</li>
 * <li>{@link NotebookProperties} - notebook ceilings, timeouts and sweep</li>
 * </ul>
 */
@Component
@ConfigurationProperties(prefix = "reasoning")
@Data
public class ReasoningProperties {

    private SessionProperties session = new SessionProperties();
    private StorageProperties storage = new StorageProperties();
    private PersistenceProperties persistence = new PersistenceProperties();
    private NotebookProperties notebook = new NotebookProperties();

    @Data
    public static class SessionProperties {
        private Duration timeout = Duration.ofHours(1);
        private int maxThoughtsPerSession = 100;
        /** Per-kind ceilings; 0 or absent means unbounded. Thoughts use maxThoughtsPerSession. */
        private Map<ArtifactKind, Integer> capacities = new EnumMap<>(ArtifactKind.class);
        private DeploymentMode defaultGraphMode = DeploymentMode.STANDARD;
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/reasoning";
    }

    @Data
    public static class PersistenceProperties {
        private boolean enabled = false;
        private String directory = "unified";
        private String storeFile = "unified-store.json";
        private String knowledgeGraphFile = "knowledge-graph.json";
        private Duration debounce = Duration.ofMillis(300);
    }

    @Data
    public static class NotebookProperties {
        private Duration defaultTimeout = Duration.ofSeconds(5);
        private Duration maxTimeout = Duration.ofSeconds(60);
        private int maxCells = 200;
        private int maxExecutions = 200;
        private int maxOutputBytesPerExec = 262_144;
        private Duration idleTtl = Duration.ofMinutes(30);
        private Duration sweepInterval = Duration.ofSeconds(60);
        private String presetsLocation = "classpath:notebook/presets.json";
    }
}
