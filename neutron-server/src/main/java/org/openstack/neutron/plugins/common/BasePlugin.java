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

import java.util.Set;

import com.google.common.collect.ImmutableSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.common.Constants;
import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.db.AgentSchedulerNotifiers;
import org.openstack.neutron.db.DhcpAgentScheduler;
import org.openstack.neutron.manager.CorePlugin;
import org.openstack.neutron.rpc.Notifier;
import org.openstack.neutron.rpc.Rpc;

/**
 * Core plugin behaviour shared by the plugins that schedule networks on DHCP
 * agents: registers the DHCP notifier and starts the agent liveness check.
 */
public abstract class BasePlugin implements CorePlugin {

    private static final Logger log = LoggerFactory.getLogger(BasePlugin.class);

    private final ConfigOpts conf;
    private final DhcpAgentScheduler dhcpScheduler;

    protected BasePlugin(ConfigOpts conf) {
        this.conf = conf;
        this.dhcpScheduler = new DhcpAgentScheduler(conf);
        AgentSchedulerNotifiers.register(
            Constants.AGENT_TYPE_DHCP,
            new DhcpAgentNotifier(this, dhcpNotifier()));
        dhcpScheduler.startPeriodicDhcpAgentStatusCheck();
        log.debug("{} initialized", getClass().getSimpleName());
    }

    private static Notifier dhcpNotifier() {
        return Rpc.isInitialized() ? Rpc.getNotifier("dhcp_agent", null)
                                   : null;
    }

    protected ConfigOpts getConf() {
        return conf;
    }

    public DhcpAgentScheduler getDhcpScheduler() {
        return dhcpScheduler;
    }

    @Override
    public Set<String> getSupportedExtensionAliases() {
        return ImmutableSet.of("agent", "dhcp_agent_scheduler");
    }
}
