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

package me.golemcore.reasoning.domain.notebook;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.reasoning.infrastructure.config.ReasoningProperties;
import org.springframework.core.io.DefaultResourceLoader;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Notebook templates loaded once from {@code reasoning.notebook.presets-location}
 * (a JSON object keyed by preset name). A missing or unreadable file leaves the
 * registry empty.
 */
@Component
@Slf4j
public class NotebookPresetRegistry {

    private final String location;
    private final ObjectMapper objectMapper;
    private final Map<String, NotebookPreset> presets = new LinkedHashMap<>();

    public NotebookPresetRegistry(ReasoningProperties properties, ObjectMapper objectMapper) {
        this.location = properties.getNotebook().getPresetsLocation();
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        Resource resource = new DefaultResourceLoader().getResource(location);
        if (!resource.exists()) {
            log.warn("[Notebook] No presets found at {}", location);
            return;
        }
        try (InputStream is = resource.getInputStream()) {
            Map<String, NotebookPreset> loaded = objectMapper.readValue(is,
                    new TypeReference<LinkedHashMap<String, NotebookPreset>>() {
                    });
            synchronized (this) {
                presets.clear();
                loaded.forEach((key, preset) -> {
                    preset.setKey(key);
                    presets.put(key, preset);
                });
            }
            log.info("[Notebook] Loaded {} presets from {}", loaded.size(), location);
        } catch (IOException e) {
            log.warn("[Notebook] Failed to load presets from {}: {}", location, e.getMessage());
        }
    }

    public synchronized Optional<NotebookPreset> get(String key) {
        return Optional.ofNullable(presets.get(key));
    }

    public synchronized List<NotebookPreset> list() {
        return new ArrayList<>(presets.values());
    }
}
