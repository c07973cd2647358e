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

package me.golemcore.reasoning;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Entry point of the reasoning core.
 *
 * <p>
 * Hosts per-session reasoning artifact stores, capacity-bounded knowledge
 * graphs, the process-wide unified artifact store with optional disk
 * persistence, and sandboxed JavaScript notebooks.
 *
 * <h2>Architecture</h2>
 *
 * <pre>
 * Domain Layer       → ReasoningSessionService, KnowledgeGraph, NotebookStore
 * Ports              → StoragePort, SchedulerPort, SandboxPort
 * Infrastructure     → LocalStorageAdapter, ExecutorSchedulerAdapter, RhinoSandboxAdapter
 * </pre>
 *
 * <p>
 * All configuration via {@code application.properties} under the
 * {@code reasoning.*} prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ReasoningCoreApplication {

    public static void main(String[] args) {
        SpringApplication.run(ReasoningCoreApplication.class, args);
    }

}
