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
package org.openstack.neutron.rpc;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * The messaging transport selected by the configuration, with the servers
 * currently consuming from each topic.
 */
public class Transport {

    private final String driver;
    private final int responseTimeout;
    private final ImmutableList<String> allowedRemoteExmods;
    private final Map<String, List<Object>> endpoints =
        new ConcurrentHashMap<>();

    public Transport(String driver, int responseTimeout,
                     List<String> allowedRemoteExmods) {
        this.driver = driver;
        this.responseTimeout = responseTimeout;
        this.allowedRemoteExmods = ImmutableList.copyOf(allowedRemoteExmods);
    }

    public String getDriver() {
        return driver;
    }

    public boolean isFake() {
        return RpcConfig.FAKE_DRIVER.equals(driver);
    }

    public int getResponseTimeout() {
        return responseTimeout;
    }

    public List<String> getAllowedRemoteExmods() {
        return allowedRemoteExmods;
    }

    void addEndpoints(String topic, List<Object> topicEndpoints) {
        endpoints.computeIfAbsent(topic, t -> new CopyOnWriteArrayList<>())
                 .addAll(topicEndpoints);
    }

    void removeEndpoints(String topic, List<Object> topicEndpoints) {
        List<Object> current = endpoints.get(topic);
        if (current != null) {
            current.removeAll(topicEndpoints);
        }
    }

    public List<Object> getEndpoints(String topic) {
        List<Object> current = endpoints.get(topic);
        return current == null ? ImmutableList.of()
                               : new ArrayList<>(current);
    }

    public void cleanup() {
        endpoints.clear();
    }

    @Override
    public String toString() {
        return MoreObjects.toStringHelper(this)
            .add("driver", driver)
            .add("responseTimeout", responseTimeout)
            .toString();
    }
}
