/*
 * Copyright 2026 the original author or authors.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.querylens.agent.config;

import java.io.File;
import java.io.IOException;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableList;
import com.google.common.io.Files;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querylens.common.util.ObjectMappers;

import static com.google.common.base.Charsets.UTF_8;

// config.json in the agent's conf directory, one top level section per config class
class ConfigFile {

    private static final Logger logger = LoggerFactory.getLogger(ConfigFile.class);

    // log startup messages using logger name "org.querylens"
    private static final Logger startupLogger = LoggerFactory.getLogger("org.querylens");

    private static final ObjectMapper mapper = ObjectMappers.create();

    private static final List<String> SECTION_ORDER =
            ImmutableList.of("general", "datastoreTracer", "advanced");

    private final File file;
    private final boolean readOnly;
    private final ObjectNode rootNode;

    ConfigFile(File confDir, boolean readOnly) {
        file = new File(confDir, "config.json");
        this.readOnly = readOnly;
        // config-default.json lets a packaged distribution ship different defaults
        File defaultFile = new File(confDir, "config-default.json");
        if (file.exists()) {
            rootNode = readRootNode(file);
        } else if (defaultFile.exists()) {
            rootNode = readRootNode(defaultFile);
        } else {
            rootNode = mapper.createObjectNode();
        }
    }

    <T> @Nullable T getSection(String name, Class<T> clazz) {
        JsonNode node = rootNode.get(name);
        if (node == null) {
            return null;
        }
        try {
            return mapper.treeToValue(node, clazz);
        } catch (JsonProcessingException e) {
            logger.warn("invalid '{}' section in {}, using defaults: {}", name,
                    file.getAbsolutePath(), e.getMessage());
            return null;
        }
    }

    void writeSection(String name, Object config) throws IOException {
        if (readOnly) {
            throw new IllegalStateException("Running with config.readOnly=true so config updates"
                    + " are not allowed");
        }
        rootNode.set(name, mapper.valueToTree(config));
        write(false);
    }

    // fills in missing properties so that the file documents every available setting
    void writeAllSectionsOnStartup(Map<String, Object> sections) throws IOException {
        for (Map.Entry<String, Object> entry : sections.entrySet()) {
            rootNode.set(entry.getKey(), mapper.valueToTree(entry.getValue()));
        }
        write(readOnly);
    }

    private void write(boolean logInstead) throws IOException {
        String content = toOrderedJson();
        if (file.exists() && content.equals(Files.asCharSource(file, UTF_8).read())) {
            // leave the file alone so that its modification time reflects real changes
            return;
        }
        if (logInstead) {
            startupLogger.info("not updating {} since the agent is running with"
                    + " config.readOnly=true, the full config is:\n{}", file.getName(), content);
            return;
        }
        Files.asCharSink(file, UTF_8).write(content);
    }

    private String toOrderedJson() throws JsonProcessingException {
        ObjectNode orderedNode = mapper.createObjectNode();
        for (String name : SECTION_ORDER) {
            JsonNode node = rootNode.get(name);
            if (node != null) {
                orderedNode.set(name, node);
            }
        }
        // unrecognized sections are preserved after the known ones
        Iterator<Map.Entry<String, JsonNode>> i = rootNode.fields();
        while (i.hasNext()) {
            Map.Entry<String, JsonNode> entry = i.next();
            if (!orderedNode.has(entry.getKey())) {
                orderedNode.set(entry.getKey(), entry.getValue());
            }
        }
        return ObjectMappers.prettyWriter(mapper).writeValueAsString(orderedNode)
                + System.lineSeparator();
    }

    private static ObjectNode readRootNode(File file) {
        String content;
        try {
            content = Files.asCharSource(file, UTF_8).read();
        } catch (IOException e) {
            logger.error("error reading config file {}: {}", file.getAbsolutePath(),
                    e.getMessage(), e);
            return mapper.createObjectNode();
        }
        try {
            JsonNode node = mapper.readTree(content);
            if (node instanceof ObjectNode) {
                return (ObjectNode) node;
            }
            logger.warn("config file {} does not contain a json object",
                    file.getAbsolutePath());
        } catch (JsonProcessingException e) {
            logger.warn("error parsing config file {}: {}", file.getAbsolutePath(),
                    e.getMessage());
        }
        backUpInvalidFile(file);
        return mapper.createObjectNode();
    }

    private static void backUpInvalidFile(File file) {
        File backupFile = new File(file.getParentFile(), file.getName() + ".invalid-orig");
        try {
            Files.copy(file, backupFile);
            logger.warn("the invalid config file has been backed up to {} and will be"
                    + " overwritten with the default config", backupFile.getName());
        } catch (IOException e) {
            logger.warn("error backing up the invalid config file {}", file.getAbsolutePath(),
                    e);
        }
    }
}
