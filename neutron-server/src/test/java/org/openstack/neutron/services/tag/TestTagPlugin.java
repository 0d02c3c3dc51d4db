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

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;

import org.openstack.neutron.callbacks.CallbacksManager;
import org.openstack.neutron.callbacks.Events;
import org.openstack.neutron.callbacks.Registry;
import org.openstack.neutron.callbacks.Resources;
import org.openstack.neutron.util.Substitutable;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.hamcrest.Matchers.is;

public class TestTagPlugin {

    private Substitutable<CallbacksManager>.Restorer registry;
    private TagPlugin plugin;

    @Before
    public void setUp() {
        registry = Registry.CALLBACK_MANAGER.substitute(new CallbacksManager());
        plugin = new TagPlugin();
    }

    @After
    public void tearDown() {
        registry.close();
    }

    @Test
    public void testTags() {
        plugin.updateTags(Resources.NETWORK, "net-1", ImmutableSet.of("red"));
        assertThat(plugin.getTags(Resources.NETWORK, "net-1"), contains("red"));
        assertThat(plugin.getTags(Resources.PORT, "net-1"), is(empty()));
    }

    @Test
    public void testTagsOfDeletedResourcesAreDropped() {
        plugin.updateTags(Resources.PORT, "p-1", ImmutableSet.of("blue"));
        plugin.updateTags(Resources.PORT, "p-2", ImmutableSet.of("green"));

        Registry.notify(Resources.PORT, Events.AFTER_DELETE, this,
                        ImmutableMap.<String, Object>of("id", "p-1"));

        assertThat(plugin.getTags(Resources.PORT, "p-1"), is(empty()));
        assertThat(plugin.getTags(Resources.PORT, "p-2"), contains("green"));
    }

    @Test
    public void testPluginType() {
        assertThat(plugin.getPluginType(), is(TagPlugin.PLUGIN_TYPE));
    }
}
