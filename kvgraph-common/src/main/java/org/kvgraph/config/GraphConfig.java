/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.kvgraph.config;

import java.io.File;
import java.util.Map;

import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.FileBasedConfiguration;
import org.apache.commons.configuration2.PropertiesConfiguration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.apache.commons.configuration2.builder.FileBasedConfigurationBuilder;
import org.apache.commons.configuration2.builder.fluent.Configurations;
import org.apache.commons.configuration2.builder.fluent.Parameters;
import org.apache.commons.configuration2.ex.ConfigurationException;
import org.apache.commons.io.FilenameUtils;
import org.kvgraph.util.E;
import org.kvgraph.util.Log;
import org.slf4j.Logger;

/**
 * Configuration of a graph store. Every key registered in
 * {@link OptionSpace} is parsed and checked when it is added, so a bad
 * value fails at construction time instead of at first use.
 */
public class GraphConfig extends PropertiesConfiguration {

    private static final Logger LOG = Log.logger(GraphConfig.class);

    public GraphConfig() {
        // All options take their default values
    }

    public GraphConfig(Configuration config) {
        if (config == null) {
            throw new ConfigException("The config object is null");
        }
        this.append(config);
    }

    public GraphConfig(String configFile) {
        this(loadConfigFile(configFile));
    }

    public GraphConfig(Map<String, ?> propertyMap) {
        if (propertyMap == null) {
            throw new ConfigException("The property map is null");
        }
        for (Map.Entry<String, ?> kv : propertyMap.entrySet()) {
            this.addProperty(kv.getKey(), kv.getValue());
        }
    }

    @SuppressWarnings("unchecked")
    public <T, R> R get(TypedOption<T, R> option) {
        Object value = this.getProperty(option.name());
        if (value == null) {
            return option.defaultValue();
        }
        return (R) value;
    }

    @Override
    public void addPropertyDirect(String key, Object value) {
        TypedOption<?, ?> option = OptionSpace.get(key);
        if (option == null) {
            LOG.warn("The config option '{}' is redundant, " +
                     "please ensure it has been registered", key);
        } else {
            // The input value is String(parsed by PropertiesConfiguration)
            value = this.validateOption(option, value);
        }
        super.addPropertyDirect(key, value);
    }

    @Override
    protected void addPropertyInternal(String key, Object value) {
        this.addPropertyDirect(key, value);
    }

    private Object validateOption(TypedOption<?, ?> option, Object value) {
        if (value instanceof String) {
            return option.parseConvert(value);
        }

        Class<?> dataType = option.dataType();
        if (dataType.isInstance(value)) {
            return option.parseConvert(value);
        }

        throw new ConfigException("Invalid value for key '%s': '%s'",
                                  option.name(), value);
    }

    private static Configuration loadConfigFile(String path) {
        E.checkNotNull(path, "config path");
        E.checkArgument(!path.isEmpty(),
                        "The config path can't be empty");

        File file = new File(path);
        E.checkArgument(file.exists() && file.isFile() && file.canRead(),
                        "Please specify a proper config file rather than: '%s'",
                        file.toString());

        try {
            String fileExtension = FilenameUtils.getExtension(file.getName());
            Configurations configs = new Configurations();
            switch (fileExtension) {
                case "yml":
                case "yaml":
                    Parameters params = new Parameters();
                    FileBasedConfigurationBuilder<FileBasedConfiguration>
                    builder = new FileBasedConfigurationBuilder<>(
                                  YAMLConfiguration.class);
                    builder.configure(params.fileBased().setFile(file));
                    return builder.getConfiguration();
                case "xml":
                    return configs.xml(file);
                default:
                    return configs.properties(file);
            }
        } catch (ConfigurationException e) {
            throw new ConfigException("Unable to load config: '%s'", e, path);
        }
    }
}
