/*
 * Copyright 2016 Midokura SARL
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
package org.openstack.neutron.config;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;

import com.google.common.base.Joiner;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;

import org.apache.commons.configuration.ConfigurationException;
import org.apache.commons.configuration.HierarchicalConfiguration;
import org.apache.commons.configuration.HierarchicalINIConfiguration;
import org.apache.commons.configuration.SubnodeConfiguration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.util.StringUtil;
import org.openstack.neutron.util.Substitutable;

/**
 * Layered configuration: overrides on top of the loaded INI files on top of
 * registered defaults.
 *
 * Overrides and defaults are meant to be temporary; {@link #reset()} drops
 * all of them and leaves only what the files say. Options are addressed by
 * a group (an INI section, {@value #DEFAULT_GROUP} when none is given) and a
 * key.
 */
public class ConfigOpts extends ConfigProvider {

    private static final Logger log =
        LoggerFactory.getLogger(ConfigOpts.class);

    public static final String DEFAULT_GROUP = "DEFAULT";

    public static final String CONFIG_FILE_ARG = "--config-file";

    /**
     * Where {@link #init(List)} looks for files when the arguments name
     * none.
     */
    public static final Substitutable<ConfigFileFinder> CONFIG_FILE_FINDER =
        new Substitutable<>("config-file-finder",
                            ConfigFileFinder.STANDARD_LOCATIONS);

    /**
     * The configuration of this process.
     */
    public static final ConfigOpts CONF = new ConfigOpts("neutron");

    private static final Object NONE = new Object() {
        @Override
        public String toString() {
            return "None";
        }
    };

    private final String project;
    private final List<HierarchicalConfiguration> sources =
        new CopyOnWriteArrayList<>();
    private final List<String> configFiles = new CopyOnWriteArrayList<>();
    private final Map<String, Object> overrides = new ConcurrentHashMap<>();
    private final Map<String, Object> defaults = new ConcurrentHashMap<>();

    public ConfigOpts(String project) {
        this.project = project;
    }

    public String getProject() {
        return project;
    }

    /**
     * Parses command line style arguments and loads the configuration files
     * they name with {@value #CONFIG_FILE_ARG}. Previously loaded files are
     * forgotten; overrides are kept.
     */
    public void init(@Nonnull List<String> args) {
        List<String> files = new ArrayList<>();
        for (int i = 0; i < args.size(); i++) {
            String arg = args.get(i);
            if (arg.equals(CONFIG_FILE_ARG)) {
                if (i + 1 >= args.size()) {
                    throw new IllegalArgumentException(
                        CONFIG_FILE_ARG + " requires a file name");
                }
                files.add(args.get(++i));
            } else if (arg.startsWith(CONFIG_FILE_ARG + "=")) {
                files.add(arg.substring(CONFIG_FILE_ARG.length() + 1));
            } else {
                throw new IllegalArgumentException(
                    "Unrecognized argument: " + arg);
            }
        }
        if (files.isEmpty()) {
            files.addAll(CONFIG_FILE_FINDER.get().findConfigFiles(project));
        }

        sources.clear();
        configFiles.clear();
        for (String file : files) {
            loadFile(file);
        }
    }

    /**
     * Loads an INI file. Files loaded later take precedence.
     */
    public void loadFile(@Nonnull String path) {
        try {
            HierarchicalINIConfiguration config =
                new HierarchicalINIConfiguration();
            config.setDelimiterParsingDisabled(true);
            config.setFileName(path);
            config.load();
            sources.add(config);
            configFiles.add(path);
            log.debug("Loaded configuration file {}", path);
        } catch (ConfigurationException e) {
            throw new IllegalArgumentException(
                "Cannot load configuration file " + path, e);
        }
    }

    public void addSource(@Nonnull HierarchicalConfiguration config) {
        sources.add(config);
    }

    public List<String> getConfigFiles() {
        return ImmutableList.copyOf(configFiles);
    }

    public void setOverride(String key, @Nullable Object value) {
        setOverride(key, value, null);
    }

    /**
     * Forces {@code key} in {@code group} to {@code value} until the override
     * is cleared or the configuration reset. A null value overrides the
     * option to "unset".
     */
    public void setOverride(String key, @Nullable Object value,
                            @Nullable String group) {
        overrides.put(qualify(group, key), value == null ? NONE : value);
        log.trace("Override {}.{} = {}", groupOf(group), key, value);
    }

    public void clearOverride(String key, @Nullable String group) {
        overrides.remove(qualify(group, key));
    }

    public void setDefault(String key, @Nullable Object value,
                           @Nullable String group) {
        defaults.put(qualify(group, key), value == null ? NONE : value);
    }

    public boolean hasOverride(String key, @Nullable String group) {
        return overrides.containsKey(qualify(group, key));
    }

    /**
     * Drops every override and default.
     */
    public void reset() {
        if (!overrides.isEmpty()) {
            log.debug("Clearing configuration overrides {}",
                      overrides.keySet());
        }
        overrides.clear();
        defaults.clear();
    }

    /**
     * Forgets the loaded files as well.
     */
    public void clear() {
        reset();
        sources.clear();
        configFiles.clear();
    }

    @Nullable
    public Object get(String key) {
        return get(null, key);
    }

    /**
     * Returns the effective raw value of an option, or null.
     */
    @Nullable
    public Object get(@Nullable String group, String key) {
        String qualified = qualify(group, key);
        Object value = overrides.get(qualified);
        if (value == null) {
            value = fromSources(groupOf(group), key);
        }
        if (value == null) {
            value = defaults.get(qualified);
        }
        return value == NONE ? null : value;
    }

    @Nullable
    public String getString(String key) {
        return getValue(null, key, (String) null);
    }

    public List<String> getList(String key) {
        return getList(null, key);
    }

    /**
     * Returns a list option; string values are split on commas.
     */
    @SuppressWarnings("unchecked")
    public List<String> getList(@Nullable String group, String key) {
        Object value = get(group, key);
        if (value == null) {
            return ImmutableList.of();
        }
        if (value instanceof Collection) {
            List<String> items = new ArrayList<>();
            for (Object item : (Collection<Object>) value) {
                items.add(String.valueOf(item));
            }
            return ImmutableList.copyOf(items);
        }
        return ImmutableList.copyOf(Splitter.on(',').trimResults()
                                        .omitEmptyStrings()
                                        .split(value.toString()));
    }

    @Override
    public String getValue(String group, String key, String defaultValue) {
        Object value = get(group, key);
        if (value == null) {
            return defaultValue;
        }
        if (value instanceof Collection) {
            return Joiner.on(',').join((Collection<?>) value);
        }
        return value.toString();
    }

    @Override
    public boolean getValue(String group, String key, boolean defaultValue) {
        Object value = get(group, key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        return value == null
               ? defaultValue
               : StringUtil.boolFromString(value.toString(), false,
                                           defaultValue);
    }

    @Override
    public int getValue(String group, String key, int defaultValue) {
        Object value = get(group, key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        return value == null ? defaultValue
                             : Integer.parseInt(value.toString().trim());
    }

    @Override
    public long getValue(String group, String key, long defaultValue) {
        Object value = get(group, key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        return value == null ? defaultValue
                             : Long.parseLong(value.toString().trim());
    }

    private Object fromSources(String group, String key) {
        for (int i = sources.size() - 1; i >= 0; i--) {
            HierarchicalConfiguration config = sources.get(i);
            String value = null;
            try {
                SubnodeConfiguration subConfig = config.configurationAt(group);
                value = subConfig.getString(key);
            } catch (IllegalArgumentException ex) {
                // the file has no such section
                log.trace("No section {} in {}", group, config);
            }
            if (value == null && DEFAULT_GROUP.equals(group)) {
                value = config.getString(key);
            }
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    private static String groupOf(@Nullable String group) {
        return StringUtil.isNullOrEmpty(group) ? DEFAULT_GROUP : group;
    }

    private static String qualify(@Nullable String group, String key) {
        return groupOf(group) + "/" + key;
    }
}
