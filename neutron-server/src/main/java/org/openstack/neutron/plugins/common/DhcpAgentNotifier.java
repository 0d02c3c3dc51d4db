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
package org.openstack.neutron.plugins.common;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.manager.CorePlugin;
import org.openstack.neutron.rpc.Notifier;

/**
 * Tells the DHCP agents about changes to the resources of a plugin.
 */
public class DhcpAgentNotifier {

    private static final Logger log =
        LoggerFactory.getLogger(DhcpAgentNotifier.class);

    private final CorePlugin plugin;
    private final Notifier notifier;

    public DhcpAgentNotifier(CorePlugin plugin, Notifier notifier) {
        this.plugin = plugin;
        this.notifier = notifier;
    }

    public CorePlugin getPlugin() {
        return plugin;
    }

    public void notify(String eventType, Map<String, Object> payload) {
        log.debug("Notifying DHCP agents of {}", eventType);
        if (notifier != null) {
            notifier.info(eventType, payload);
        }
    }
}
