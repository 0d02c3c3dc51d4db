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

import java.util.List;

import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.AbstractIdleService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Consumes a topic of a transport, exposing a set of endpoints while it
 * runs.
 */
public class RpcServer extends AbstractIdleService {

    private static final Logger log = LoggerFactory.getLogger(RpcServer.class);

    private final Transport transport;
    private final String topic;
    private final ImmutableList<Object> endpoints;

    public RpcServer(Transport transport, String topic, List<Object> endpoints) {
        this.transport = transport;
        this.topic = topic;
        this.endpoints = ImmutableList.copyOf(endpoints);
    }

    public String getTopic() {
        return topic;
    }

    @Override
    protected void startUp() {
        transport.addEndpoints(topic, endpoints);
        log.debug("Consuming {} with {}", topic, endpoints);
    }

    @Override
    protected void shutDown() {
        transport.removeEndpoints(topic, endpoints);
        log.debug("Stopped consuming {}", topic);
    }
}
