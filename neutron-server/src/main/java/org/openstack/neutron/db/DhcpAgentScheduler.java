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
package org.openstack.neutron.db;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigBool;
import org.openstack.neutron.config.ConfigGroup;
import org.openstack.neutron.config.ConfigInt;
import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.util.Substitutable;
import org.openstack.neutron.util.eventloop.NeutronThreadFactory;

/**
 * Tracks DHCP agent liveness for a plugin and reschedules networks away from
 * agents that stopped reporting.
 */
public class DhcpAgentScheduler {

    private static final Logger log =
        LoggerFactory.getLogger(DhcpAgentScheduler.class);

    @ConfigGroup
    public interface SchedulerConfig {
        @ConfigBool(key = "allow_automatic_dhcp_failover", defaultValue = true)
        boolean isAutomaticFailoverAllowed();

        @ConfigInt(key = "agent_down_time", defaultValue = 75)
        int getAgentDownTime();
    }

    /**
     * Starts the periodic liveness check of a scheduler.
     */
    public interface PeriodicStatusCheck {
        void startPeriodicDhcpAgentStatusCheck(DhcpAgentScheduler scheduler);
    }

    /**
     * Runs a status check of a scheduler periodically.
     */
    public interface AgentStatusCheck {
        void addAgentStatusCheck(DhcpAgentScheduler scheduler, Runnable check);
    }

    public static final PeriodicStatusCheck FAILOVER_CHECK =
        new PeriodicStatusCheck() {
            @Override
            public void startPeriodicDhcpAgentStatusCheck(
                    DhcpAgentScheduler scheduler) {
                if (!scheduler.config.isAutomaticFailoverAllowed()) {
                    log.info("Skipping periodic DHCP agent status check " +
                             "because automatic network rescheduling is " +
                             "disabled.");
                    return;
                }
                scheduler.addAgentStatusCheck(
                    scheduler::removeNetworksFromDownAgents);
            }

            @Override
            public String toString() {
                return "failover-check";
            }
        };

    public static final AgentStatusCheck SCHEDULED_CHECK =
        new AgentStatusCheck() {
            @Override
            public void addAgentStatusCheck(DhcpAgentScheduler scheduler,
                                            Runnable check) {
                long interval = Math.max(1, scheduler.getCheckInterval());
                scheduler.executor().scheduleWithFixedDelay(
                    check, interval, interval, TimeUnit.SECONDS);
            }

            @Override
            public String toString() {
                return "scheduled-check";
            }
        };

    public static final Substitutable<PeriodicStatusCheck> PERIODIC_CHECK =
        new Substitutable<>("dhcp-periodic-status-check", FAILOVER_CHECK);

    public static final Substitutable<AgentStatusCheck> STATUS_CHECK =
        new Substitutable<>("agent-status-check", SCHEDULED_CHECK);

    private final SchedulerConfig config;
    private ScheduledExecutorService executor;
    private volatile int rescheduleRounds = 0;

    public DhcpAgentScheduler(ConfigOpts conf) {
        this.config = conf.getConfig(SchedulerConfig.class);
    }

    public void startPeriodicDhcpAgentStatusCheck() {
        PERIODIC_CHECK.get().startPeriodicDhcpAgentStatusCheck(this);
    }

    public void addAgentStatusCheck(Runnable check) {
        STATUS_CHECK.get().addAgentStatusCheck(this, check);
    }

    /**
     * Half of the agent down time, so that a dead agent is noticed within
     * one down-time period.
     */
    public int getCheckInterval() {
        return config.getAgentDownTime() / 2;
    }

    public void removeNetworksFromDownAgents() {
        rescheduleRounds++;
        log.debug("Checking for networks hosted by down DHCP agents");
    }

    public int getRescheduleRounds() {
        return rescheduleRounds;
    }

    public void stop() {
        ScheduledExecutorService current;
        synchronized (this) {
            current = executor;
            executor = null;
        }
        if (current != null) {
            current.shutdownNow();
        }
    }

    private synchronized ScheduledExecutorService executor() {
        if (executor == null) {
            executor = Executors.newSingleThreadScheduledExecutor(
                new NeutronThreadFactory("dhcp-agent-status"));
        }
        return executor;
    }
}
