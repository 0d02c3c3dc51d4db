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
package org.openstack.neutron.services.tag;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableSet;

import org.openstack.neutron.callbacks.Callback;
import org.openstack.neutron.callbacks.Events;
import org.openstack.neutron.callbacks.Registry;
import org.openstack.neutron.callbacks.Resources;
import org.openstack.neutron.manager.ServicePlugin;

/**
 * Keeps string tags on networks and ports. Tags of a deleted resource are
 * dropped.
 */
public class TagPlugin implements ServicePlugin {

    public static final String PLUGIN_TYPE = "TAG";

    private final Map<String, Set<String>> tags = new ConcurrentHashMap<>();

    private final Callback onDelete = (resource, event, trigger, kwargs) -> {
        Object id = kwargs.get("id");
        if (id != null) {
            tags.remove(key(resource, id.toString()));
        }
    };

    public TagPlugin() {
        Registry.subscribe(onDelete, Resources.NETWORK, Events.AFTER_DELETE);
        Registry.subscribe(onDelete, Resources.PORT, Events.AFTER_DELETE);
    }

    @Override
    public String getPluginType() {
        return PLUGIN_TYPE;
    }

    @Override
    public String getPluginDescription() {
        return "Tag support";
    }

    public void updateTags(String resource, String id, Set<String> newTags) {
        tags.put(key(resource, id), ImmutableSet.copyOf(newTags));
    }

    public Set<String> getTags(String resource, String id) {
        Set<String> found = tags.get(key(resource, id));
        return found == null ? ImmutableSet.<String>of() : found;
    }

    private static String key(String resource, String id) {
        return resource + "/" + id;
    }
}
