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

/**
 * Builds plugin instances from their class names.
 */
public interface PluginFactory {

    /**
     * @throws PluginLoadException if the class cannot be found, is not a
     *         {@code type} or cannot be instantiated
     */
    <T> T create(String className, Class<T> type);
}
