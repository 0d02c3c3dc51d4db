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

import com.google.common.collect.ImmutableMap;
import com.google.inject.AbstractModule;
import com.google.inject.ConfigurationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.ProvisionException;

import org.openstack.neutron.config.ConfigOpts;

/**
 * Instantiates plugins through a Guice injector that provides the
 * configuration. Plugin classes need an {@code @Inject} constructor or a
 * public no-argument one.
 */
public class GuicePluginFactory implements PluginFactory {

    private final ConfigOpts conf;
    private volatile Injector injector;

    public GuicePluginFactory(ConfigOpts conf) {
        this.conf = conf;
    }

    private class PluginModule extends AbstractModule {
        @Override
        protected void configure() {
            bind(ConfigOpts.class).toInstance(conf);
        }
    }

    private Injector injector() {
        if (injector == null) {
            synchronized (this) {
                if (injector == null) {
                    injector = Guice.createInjector(new PluginModule());
                }
            }
        }
        return injector;
    }

    @Override
    public <T> T create(String className, Class<T> type) {
        Class<?> clazz;
        try {
            clazz = Class.forName(className);
        } catch (ClassNotFoundException e) {
            throw new PluginLoadException(
                "Plugin '{plugin}' not found.",
                ImmutableMap.of("plugin", className), e);
        }
        if (!type.isAssignableFrom(clazz)) {
            throw new PluginLoadException(
                "Plugin '{plugin}' is not a {type}.",
                ImmutableMap.of("plugin", className,
                                "type", type.getSimpleName()));
        }
        try {
            return type.cast(injector().getInstance(clazz));
        } catch (ConfigurationException | ProvisionException e) {
            throw new PluginLoadException(
                "Plugin '{plugin}' could not be instantiated.",
                ImmutableMap.of("plugin", className), e);
        }
    }

    @Override
    public String toString() {
        return "guice-plugin-factory";
    }
}
