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
package org.openstack.neutron.agent.linux;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractExecutionThreadService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigGroup;
import org.openstack.neutron.config.ConfigInt;
import org.openstack.neutron.config.ConfigOpts;
import org.openstack.neutron.config.ConfigString;
import org.openstack.neutron.util.ExecutionContext;
import org.openstack.neutron.util.Substitutable;
import org.openstack.neutron.util.SystemExit;
import org.openstack.neutron.util.eventloop.NeutronThreadFactory;

/**
 * Watches the external processes of an agent and applies the configured
 * action when one of them dies.
 *
 * The checks run on a worker started through {@link #SPAWNER} when the
 * monitor is built, provided the check interval is positive. The worker
 * runs in an execution context spawned from the creator's.
 */
public class ProcessMonitor {

    private static final Logger log =
        LoggerFactory.getLogger(ProcessMonitor.class);

    public static final String RESPAWN = "respawn";
    public static final String EXIT = "exit";

    @ConfigGroup("AGENT")
    public interface MonitorConfig {
        @ConfigInt(key = "check_child_processes_interval", defaultValue = 60)
        int getCheckInterval();

        @ConfigString(key = "check_child_processes_action",
                      defaultValue = RESPAWN)
        String getCheckAction();
    }

    /**
     * Starts the checking worker of a monitor.
     */
    public interface Spawner {
        void spawn(ProcessMonitor monitor);
    }

    public static final Spawner START_WORKER = new Spawner() {
        @Override
        public void spawn(ProcessMonitor monitor) {
            monitor.startChecking();
        }

        @Override
        public String toString() {
            return "start-worker";
        }
    };

    public static final Substitutable<Spawner> SPAWNER =
        new Substitutable<>("process-monitor-spawner", START_WORKER);

    private final String resourceType;
    private final int checkInterval;
    private final String checkAction;
    private final ExecutionContext context;
    private final Map<ServiceId, MonitoredProcess> processes =
        new ConcurrentHashMap<>();
    private Checker checker;

    public ProcessMonitor(ConfigOpts conf, String resourceType) {
        MonitorConfig config = conf.getConfig(MonitorConfig.class);
        this.resourceType = resourceType;
        this.checkInterval = config.getCheckInterval();
        this.checkAction = config.getCheckAction();
        if (!RESPAWN.equals(checkAction) && !EXIT.equals(checkAction)) {
            throw new IllegalArgumentException(
                "Unknown child process action: " + checkAction);
        }
        this.context = ExecutionContext.current().spawn();
        if (checkInterval > 0) {
            SPAWNER.get().spawn(this);
        }
    }

    public String getResourceType() {
        return resourceType;
    }

    public void register(String uuid, String serviceName,
                         MonitoredProcess process) {
        processes.put(new ServiceId(uuid, serviceName), process);
    }

    public void unregister(String uuid, String serviceName) {
        processes.remove(new ServiceId(uuid, serviceName));
    }

    public boolean isMonitoring(String uuid, String serviceName) {
        return processes.containsKey(new ServiceId(uuid, serviceName));
    }

    /**
     * Starts the checking worker. Has no effect if it already started.
     */
    public synchronized void startChecking() {
        if (checker != null) {
            return;
        }
        checker = new Checker();
        checker.startAsync().awaitRunning();
    }

    public synchronized boolean isChecking() {
        return checker != null && checker.isRunning();
    }

    /**
     * Stops the checking worker and forgets the monitored processes. A
     * monitor whose worker never started, already stopped or failed is left
     * as is.
     */
    public void stop() {
        Checker current;
        synchronized (this) {
            current = checker;
        }
        if (current != null) {
            try {
                current.stopAsync().awaitTerminated();
            } catch (IllegalStateException e) {
                // The worker failed, there is nothing left to stop.
                log.warn("Process monitor for {} had already failed",
                         resourceType, e);
            }
        }
        processes.clear();
    }

    /**
     * Applies the configured action to every registered process that is
     * not running.
     */
    @VisibleForTesting
    public void checkChildProcesses() {
        for (Map.Entry<ServiceId, MonitoredProcess> entry
                : processes.entrySet()) {
            if (!entry.getValue().isActive()) {
                log.error("{} for {} with uuid {} not found. The process " +
                          "should not have died", entry.getKey().getService(),
                          resourceType, entry.getKey().getUuid());
                executeAction(entry.getKey(), entry.getValue());
            }
        }
    }

    private void executeAction(ServiceId serviceId, MonitoredProcess process) {
        if (RESPAWN.equals(checkAction)) {
            log.error("Respawning {} for uuid {}", serviceId.getService(),
                      serviceId.getUuid());
            process.disable();
            process.enable();
        } else {
            log.error("Exiting agent as programmed in " +
                      "check_child_processes_action");
            throw new SystemExit(1);
        }
    }

    private class Checker extends AbstractExecutionThreadService {

        private final CountDownLatch stopped = new CountDownLatch(1);

        @Override
        protected Executor executor() {
            NeutronThreadFactory threads =
                new NeutronThreadFactory("process-monitor-" + resourceType);
            return command -> threads.newThread(context.bind(command)).start();
        }

        @Override
        protected void run() throws Exception {
            while (isRunning()) {
                if (stopped.await(checkInterval, TimeUnit.SECONDS)) {
                    return;
                }
                checkChildProcesses();
            }
        }

        @Override
        protected void triggerShutdown() {
            stopped.countDown();
        }

        @Override
        protected String serviceName() {
            return "process-monitor-" + resourceType;
        }
    }
}
