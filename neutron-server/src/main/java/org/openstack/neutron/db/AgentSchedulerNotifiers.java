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

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableMap;

/**
 * The notifiers plugins register, by agent type, so that the agent
 * schedulers can reach the agents. Process-wide.
 */
public final class AgentSchedulerNotifiers {

    private static final Map<String, Object> agentNotifiers =
        new ConcurrentHashMap<>();

    public static void register(String agentType, Object notifier) {
        agentNotifiers.put(agentType, notifier);
    }

    public static Object get(String agentType) {
        return agentNotifiers.get(agentType);
    }

    public static Map<String, Object> getAll() {
        return ImmutableMap.copyOf(agentNotifiers);
    }

    public static void reset() {
        agentNotifiers.clear();
    }

    private AgentSchedulerNotifiers() {
    }
}
