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
package org.openstack.neutron.manager;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableMap;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.common.Constants;
import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.util.Slot;
import org.openstack.neutron.util.Substitutable;

/**
 * Loads the core plugin and the service plugins and keeps them for the life
 * of the process.
 *
 * There is at most one manager, held in {@link #INSTANCE}. It is created by
 * the first {@link #getInstance()} and dropped only by
 * {@link #clearInstance()}.
 */
public class NeutronManager {

    private static final Logger log =
        LoggerFactory.getLogger(NeutronManager.class);

    public static final String CORE_PLUGIN = "core_plugin";
    public static final String SERVICE_PLUGINS = "service_plugins";

    public static final Slot<NeutronManager> INSTANCE =
        new Slot<>("neutron-manager");

    public static final Substitutable<PluginFactory> PLUGIN_FACTORY =
        new Substitutable<PluginFactory>(
            "plugin-factory", new GuicePluginFactory(ConfigOpts.CONF));

    public static final Substitutable<ServicePluginLoader>
        DEFAULT_SERVICE_PLUGINS = new Substitutable<>(
            "default-service-plugins", ServicePluginLoader.BUILT_IN);

    private final CorePlugin plugin;
    private final Map<String, Object> servicePlugins = new LinkedHashMap<>();

    @VisibleForTesting
    NeutronManager(ConfigOpts conf, PluginFactory factory) {
        String corePlugin = conf.getString(CORE_PLUGIN);
        if (corePlugin == null) {
            throw new PluginLoadException(
                "Option '{option}' is not set.",
                ImmutableMap.of("option", CORE_PLUGIN));
        }
        log.info("Loading core plugin: {}", corePlugin);
        plugin = factory.create(corePlugin, CorePlugin.class);
        servicePlugins.put(Constants.CORE, plugin);

        loadServicePlugins(conf.getList(SERVICE_PLUGINS), factory);
        loadServicePlugins(
            DEFAULT_SERVICE_PLUGINS.get().getDefaultServicePlugins(), factory);
    }

    private void loadServicePlugins(List<String> classNames,
                                    PluginFactory factory) {
        for (String className : classNames) {
            log.info("Loading service plugin: {}", className);
            ServicePlugin servicePlugin =
                factory.create(className, ServicePlugin.class);
            String type = servicePlugin.getPluginType();
            if (servicePlugins.containsKey(type)) {
                throw new PluginLoadException(
                    "Multiple plugins for service {type} were configured",
                    ImmutableMap.of("type", type));
            }
            servicePlugins.put(type, servicePlugin);
            log.debug("Successfully loaded {} plugin. Description: {}",
                      type, servicePlugin.getPluginDescription());
        }
    }

    public CorePlugin getPlugin() {
        return plugin;
    }

    /**
     * The loaded plugins by service type, the core plugin under
     * {@link Constants#CORE}.
     */
    public Map<String, Object> getServicePlugins() {
        return ImmutableMap.copyOf(servicePlugins);
    }

    public static NeutronManager getInstance() {
        return INSTANCE.getOrCreate(
            () -> new NeutronManager(ConfigOpts.CONF, PLUGIN_FACTORY.get()));
    }

    public static boolean hasInstance() {
        return !INSTANCE.isEmpty();
    }

    public static void clearInstance() {
        INSTANCE.clear();
    }
}
