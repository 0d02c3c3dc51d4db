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

import java.io.File;
import java.io.IOException;
import java.util.List;

import com.google.common.collect.ImmutableList;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs one external command and restarts it on demand.
 */
public class ProcessManager implements MonitoredProcess {

    private static final Logger log =
        LoggerFactory.getLogger(ProcessManager.class);

    private final String uuid;
    private final List<String> command;
    private final File logFile;
    private Process process;

    public ProcessManager(String uuid, List<String> command, File logFile) {
        this.uuid = uuid;
        this.command = ImmutableList.copyOf(command);
        this.logFile = logFile;
    }

    public String getUuid() {
        return uuid;
    }

    @Override
    public synchronized boolean isActive() {
        return process != null && process.isAlive();
    }

    @Override
    public synchronized void enable() {
        if (isActive()) {
            return;
        }
        ProcessBuilder builder = new ProcessBuilder(command)
            .redirectErrorStream(true);
        if (logFile != null) {
            builder.redirectOutput(ProcessBuilder.Redirect.appendTo(logFile));
        } else {
            builder.redirectOutput(ProcessBuilder.Redirect.DISCARD);
        }
        try {
            process = builder.start();
            log.debug("Started {} for {}", command, uuid);
        } catch (IOException e) {
            throw new IllegalStateException(
                "Cannot start " + command + " for " + uuid, e);
        }
    }

    @Override
    public synchronized void disable() {
        if (process == null) {
            return;
        }
        process.destroy();
        try {
            process.waitFor();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            process.destroyForcibly();
        }
        process = null;
        log.debug("Stopped {} for {}", command, uuid);
    }
}
