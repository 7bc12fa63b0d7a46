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
import java.util.Map;

import com.google.common.collect.Maps;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.querylens.common.config.AdvancedConfig;
import org.querylens.common.config.DatastoreTracerConfig;
import org.querylens.common.config.GeneralConfig;
import org.querylens.common.config.ImmutableAdvancedConfig;
import org.querylens.common.config.ImmutableDatastoreTracerConfig;
import org.querylens.common.config.ImmutableGeneralConfig;

public class ConfigService {

    private static final Logger logger = LoggerFactory.getLogger(ConfigService.class);

    private final ConfigFile configFile;

    private volatile GeneralConfig generalConfig;
    private volatile DatastoreTracerConfig datastoreTracerConfig;
    private volatile AdvancedConfig advancedConfig;

    // not persisted, this is pushed by the collector on every (re)connect
    private volatile boolean collectTraces = true;

    public static ConfigService create(File confDir, boolean configReadOnly) {
        ConfigService configService = new ConfigService(confDir, configReadOnly);
        // it's nice to update config.json on startup if it is missing some/all config properties so
        // that the file contents can be reviewed/updated/copied if desired
        try {
            configService.writeAll();
        } catch (IOException e) {
            logger.error(e.getMessage(), e);
        }
        return configService;
    }

    private ConfigService(File confDir, boolean configReadOnly) {
        configFile = new ConfigFile(confDir, configReadOnly);
        GeneralConfig generalConfig =
                configFile.getSection("general", ImmutableGeneralConfig.class);
        if (generalConfig == null) {
            this.generalConfig = ImmutableGeneralConfig.builder().build();
        } else {
            this.generalConfig = generalConfig;
        }
        DatastoreTracerConfig datastoreTracerConfig =
                configFile.getSection("datastoreTracer", ImmutableDatastoreTracerConfig.class);
        if (datastoreTracerConfig == null) {
            this.datastoreTracerConfig = ImmutableDatastoreTracerConfig.builder().build();
        } else {
            this.datastoreTracerConfig = datastoreTracerConfig;
        }
        AdvancedConfig advancedConfig =
                configFile.getSection("advanced", ImmutableAdvancedConfig.class);
        if (advancedConfig == null) {
            this.advancedConfig = ImmutableAdvancedConfig.builder().build();
        } else {
            this.advancedConfig = withValidLimits(advancedConfig);
        }
    }

    public GeneralConfig getGeneralConfig() {
        return generalConfig;
    }

    public DatastoreTracerConfig getDatastoreTracerConfig() {
        return datastoreTracerConfig;
    }

    public AdvancedConfig getAdvancedConfig() {
        return advancedConfig;
    }

    public boolean isCollectTraces() {
        return collectTraces;
    }

    public void updateCollectTraces(boolean collectTraces) {
        if (this.collectTraces != collectTraces) {
            logger.info("collector has {} trace collection",
                    collectTraces ? "enabled" : "disabled");
        }
        this.collectTraces = collectTraces;
    }

    public void updateGeneralConfig(GeneralConfig config) throws IOException {
        configFile.writeSection("general", config);
        generalConfig = config;
    }

    public void updateDatastoreTracerConfig(DatastoreTracerConfig config) throws IOException {
        configFile.writeSection("datastoreTracer", config);
        datastoreTracerConfig = config;
    }

    public void updateAdvancedConfig(AdvancedConfig config) throws IOException {
        AdvancedConfig validConfig = withValidLimits(config);
        configFile.writeSection("advanced", validConfig);
        advancedConfig = validConfig;
    }

    private void writeAll() throws IOException {
        // linked hash map to preserve ordering when writing to config file
        Map<String, Object> configs = Maps.newLinkedHashMap();
        configs.put("general", generalConfig);
        configs.put("datastoreTracer", datastoreTracerConfig);
        configs.put("advanced", advancedConfig);
        configFile.writeAllSectionsOnStartup(configs);
    }

    private static AdvancedConfig withValidLimits(AdvancedConfig config) {
        AdvancedConfig defaults = ImmutableAdvancedConfig.builder().build();
        ImmutableAdvancedConfig.Builder builder =
                ImmutableAdvancedConfig.builder().from(config);
        boolean changed = false;
        if (config.maxSlowQueries() < 1) {
            logger.warn("invalid advanced.maxSlowQueries {}, using {}", config.maxSlowQueries(),
                    defaults.maxSlowQueries());
            builder.maxSlowQueries(defaults.maxSlowQueries());
            changed = true;
        }
        if (config.maxMetrics() < 1) {
            logger.warn("invalid advanced.maxMetrics {}, using {}", config.maxMetrics(),
                    defaults.maxMetrics());
            builder.maxMetrics(defaults.maxMetrics());
            changed = true;
        }
        if (config.maxQueryParameterKeyLength() < 0) {
            logger.warn("invalid advanced.maxQueryParameterKeyLength {}, using {}",
                    config.maxQueryParameterKeyLength(), defaults.maxQueryParameterKeyLength());
            builder.maxQueryParameterKeyLength(defaults.maxQueryParameterKeyLength());
            changed = true;
        }
        if (config.maxQueryParameterValueLength() < 0) {
            logger.warn("invalid advanced.maxQueryParameterValueLength {}, using {}",
                    config.maxQueryParameterValueLength(),
                    defaults.maxQueryParameterValueLength());
            builder.maxQueryParameterValueLength(defaults.maxQueryParameterValueLength());
            changed = true;
        }
        if (config.harvestIntervalSeconds() < 1) {
            logger.warn("invalid advanced.harvestIntervalSeconds {}, using {}",
                    config.harvestIntervalSeconds(), defaults.harvestIntervalSeconds());
            builder.harvestIntervalSeconds(defaults.harvestIntervalSeconds());
            changed = true;
        }
        return changed ? builder.build() : config;
    }
}
